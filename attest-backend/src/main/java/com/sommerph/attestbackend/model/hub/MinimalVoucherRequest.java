package com.sommerph.attestbackend.model.hub;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MinimalVoucherRequest {

    private String qHash;
    private long chainId;
    private String verifierId;

}
