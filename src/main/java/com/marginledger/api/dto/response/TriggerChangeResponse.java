package com.marginledger.api.dto.response;

import com.marginledger.domain.enums.TriggerKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Result of setting a stop-loss or take-profit. {@code triggerId} is null when the trigger was cleared.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TriggerChangeResponse {

    private Long positionId;
    private TriggerKind kind;
    private Long triggerId;
}
