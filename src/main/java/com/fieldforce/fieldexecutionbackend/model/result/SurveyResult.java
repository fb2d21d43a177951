package com.fieldforce.fieldexecutionbackend.model.result;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
@AllArgsConstructor
public class SurveyResult extends ActivityResult {
    private String surveyId;
    private Map<String, String> answers = new LinkedHashMap<>();
}
