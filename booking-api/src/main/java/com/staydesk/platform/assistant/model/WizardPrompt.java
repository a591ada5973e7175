package com.staydesk.platform.assistant.model;

import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outbound message emitted after every handled input: text plus an optional
 * bounded set of options laid out in rows.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WizardPrompt {
    private String text;

    @Builder.Default
    private List<List<PromptOption>> options = new ArrayList<>();

    public static WizardPrompt text(String text) {
        return WizardPrompt.builder().text(text).build();
    }

    /**
     * Flattened list of every offered payload
     */
    public List<String> payloads() {
        List<String> payloads = new ArrayList<>();
        if (options != null) {
            options.forEach(row -> row.forEach(option -> payloads.add(option.getPayload())));
        }
        return payloads;
    }
}
