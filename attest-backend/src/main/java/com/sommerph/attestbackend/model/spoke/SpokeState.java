package com.sommerph.attestbackend.model.spoke;

import com.sommerph.attestbackend.model.common.UnitState;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class SpokeState extends UnitState {

    private long chainId;

    // fixed at deployment
    private String hub;

    // voucherId -> fulfillment; presence is the fulfillment flag
    private Map<String, SpokeFulfillment> fulfillments = new LinkedHashMap<>();

    // qHash -> voucherId
    private Map<String, String> voucherByQHash = new LinkedHashMap<>();

    private Map<String, BatchRecord> completedBatches = new LinkedHashMap<>();

}
