package com.example.scenebrain_backend.dto;

import com.example.scenebrain_backend.memory.PreferenceValue;

import java.util.List;
import java.util.Map;

/**
 * @param resolved the value the system currently acts on, per key.
 * @param all      every stored value, including competing and low-confidence ones.
 */
public record PreferencesResponse(Map<String, PreferenceValue> resolved, List<PreferenceValue> all) {
}
