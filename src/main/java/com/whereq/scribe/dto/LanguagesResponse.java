package com.whereq.scribe.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LanguagesResponse {
    private List<String> languages;

    private int count;

    public static LanguagesResponse of(List<String> languages) {
        return new LanguagesResponse(languages, languages.size());
    }
}
