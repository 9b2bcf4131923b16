package com.sommerph.attestbackend.model.common;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PendingAction {

    private String action;
    private String proposalId;
    private List<String> params = new ArrayList<>();
    private long scheduledAt;
    private long unlockAt;

}
