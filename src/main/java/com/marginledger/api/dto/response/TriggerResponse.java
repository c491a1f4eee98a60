package com.marginledger.api.dto.response;

import com.marginledger.domain.enums.TriggerKind;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TriggerResponse {

    private Long id;
    private Long positionId;
    private TriggerKind kind;
    private BigDecimal price;
}
