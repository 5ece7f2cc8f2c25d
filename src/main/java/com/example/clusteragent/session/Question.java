package com.example.clusteragent.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A configuration question attached to a solution.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Question {

    private String id;
    private String question;
    @Builder.Default
    private QuestionType type = QuestionType.TEXT;
    @Builder.Default
    private List<String> options = new ArrayList<>();
    private boolean required;
    private String placeholder;
    private Object suggestedAnswer;
}
