package com.sommerph.attestbackend.model.registry;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class VerifierInfo {

    private String verifierId;
    private String verificationType;
    private boolean active;
    private long registeredAt;

}
