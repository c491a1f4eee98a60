package com.marginledger.exception;

import java.util.Map;

/**
 * Thrown when an order, position or trigger id is not live. Ids are never reused, so a
 * cancelled, executed, closed or replaced record stays not-found for good.
 */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String recordType, long id) {
        super(
                ErrorCode.NOT_FOUND,
                String.format("%s %d not found", recordType, id),
                Map.of("type", recordType, "id", id));
    }
}
