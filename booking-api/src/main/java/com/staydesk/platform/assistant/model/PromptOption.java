package com.staydesk.platform.assistant.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PromptOption {
    private String label;
    private String payload;

    public static PromptOption of(String label, String payload) {
        return new PromptOption(label, payload);
    }
}
