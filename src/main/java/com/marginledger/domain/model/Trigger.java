package com.marginledger.domain.model;

import com.marginledger.domain.enums.TriggerKind;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Trigger {

    long id;
    long positionId;
    TriggerKind kind;
    BigDecimal price;
}
