package com.fieldforce.fieldexecutionbackend.model.result;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Catch-all for result kinds this engine does not model. Keeps every field it was given.
 */
@ToString
@EqualsAndHashCode(callSuper = false)
public class OpaqueResult extends ActivityResult {

    private Map<String, Object> data = new LinkedHashMap<>();

    public OpaqueResult() {}

    public OpaqueResult(Map<String, Object> data) {
        this.data.putAll(data);
    }

    @JsonAnyGetter
    public Map<String, Object> getData() {
        return data;
    }

    @JsonAnySetter
    public void put(String key, Object value) {
        data.put(key, value);
    }
}
