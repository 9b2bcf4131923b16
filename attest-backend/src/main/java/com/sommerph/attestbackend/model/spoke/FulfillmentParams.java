package com.sommerph.attestbackend.model.spoke;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One voucher descriptor as relayed from the hub's creation event.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FulfillmentParams {

    private String voucherId;
    private String qHash;
    private String verifier;
    private long verifiedAt;

}
