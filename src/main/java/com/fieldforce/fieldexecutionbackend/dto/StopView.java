package com.fieldforce.fieldexecutionbackend.dto;

import com.fieldforce.fieldexecutionbackend.execution.StopAccess;
import com.fieldforce.fieldexecutionbackend.model.Stop;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StopView {
    private Stop stop;
    private StopAccess access;
}
