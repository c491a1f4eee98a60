package com.marginledger.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * A position together with the ids of its live triggers. Trigger ids are null when no
 * trigger of that kind is set.
 */
@Value
@Builder
public class PositionView {

    Position position;
    Long stopLossTriggerId;
    Long takeProfitTriggerId;
    Long liquidationTriggerId;
}
