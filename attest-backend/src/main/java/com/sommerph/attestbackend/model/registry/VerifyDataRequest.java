package com.sommerph.attestbackend.model.registry;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerifyDataRequest {

    private String userAddress;
    private String qHash;

    @Builder.Default
    private List<Long> targetChainIds = new ArrayList<>();

    private String proofId;
    private String verificationType;

}
