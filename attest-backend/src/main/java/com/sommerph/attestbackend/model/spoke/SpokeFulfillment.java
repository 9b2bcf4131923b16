package com.sommerph.attestbackend.model.spoke;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SpokeFulfillment {

    private String voucherId;
    private String qHash;
    private String verifier;
    private long verifiedAt;
    private String batchId;
    private String relayer;
    private long fulfilledAt;

}
