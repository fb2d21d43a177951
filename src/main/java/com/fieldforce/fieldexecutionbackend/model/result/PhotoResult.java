package com.fieldforce.fieldexecutionbackend.model.result;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@EqualsAndHashCode(callSuper = false)
@NoArgsConstructor
@AllArgsConstructor
public class PhotoResult extends ActivityResult {
    private List<String> mediaIds = new ArrayList<>();
}
