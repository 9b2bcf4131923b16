package com.sommerph.attestbackend.model.spoke;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchFulfillmentResult {

    private String batchId;
    private int total;
    private int fulfilled;
    private int failed;

}
