package com.sommerph.attestbackend.model.spoke;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchRecord {

    private String batchId;

    // keccak over the submitted descriptors, kept for audit
    private String contentDigest;

    private int total;
    private int fulfilled;
    private int failed;
    private String relayer;
    private long completedAt;

}
