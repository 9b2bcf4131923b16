package com.sommerph.attestbackend.model.hub;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Propagation intent for one qHash. The target chain list is fixed at creation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Voucher {

    private String voucherId;
    private String qHash;

    @Builder.Default
    private List<Long> targetChainIds = new ArrayList<>();

    private String verifierId;
    private long createdAt;
    private boolean active;
    private String creator;

}
