package com.gdin.inspection.gsw.models;

import cn.hutool.core.util.StrUtil;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Question {

    private String id;

    /** entity the question is about; may be null for case-level questions */
    private String subjectId;

    private String text;

    private boolean answered;

    private String answer;

    private String caseId;

    private String answeredInChunkId;

    public static String idOf(int seq) {
        return "Q" + seq;
    }

    public void markAnswered(String answerText, String chunkId) {
        if (StrUtil.isBlank(answerText)) {
            throw new IllegalArgumentException("answered question needs a non-empty answer: " + id);
        }
        this.answered = true;
        this.answer = answerText.trim();
        this.answeredInChunkId = chunkId;
    }
}
