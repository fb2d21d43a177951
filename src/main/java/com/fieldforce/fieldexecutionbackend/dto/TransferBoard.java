package com.fieldforce.fieldexecutionbackend.dto;

import com.fieldforce.fieldexecutionbackend.execution.TransferAction;
import com.fieldforce.fieldexecutionbackend.model.Transfer;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TransferBoard {
    private Transfer transfer;
    private Set<TransferAction> permittedActions;
    private int loadingProgressPercentage;
    private List<String> pendingProducts = new ArrayList<>();
    private List<String> warnings = new ArrayList<>();
}
