package com.gdin.inspection.gsw.update;

import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.gsw.extraction.CandidateQuestion;
import com.gdin.inspection.gsw.models.Question;
import com.gdin.inspection.gsw.models.Workspace;
import com.gdin.inspection.gsw.util.TermUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Open questions: created once per subject and text, answered at most once, dropped only on request.
 */
@Slf4j
public class QuestionMergeService {

    public enum Outcome {
        CREATED,
        CREATED_ANSWERED,
        ANSWERED,
        UNCHANGED,
        /** answer for a question id the workspace does not have, and no text to create it from */
        UNKNOWN_QUESTION
    }

    public Outcome apply(Workspace workspace, CandidateQuestion candidate, Map<String, String> localIds,
                         String caseId, String chunkId) {
        String answer = TermUtil.clean(candidate.getAnswer());

        if (StrUtil.isNotBlank(candidate.getQuestionId())) {
            Question known = workspace.getQuestions().get(candidate.getQuestionId().trim());
            if (known != null) return answer(known, answer, chunkId);
        }
        String text = TermUtil.clean(candidate.getText());
        if (text == null) {
            log.warn("answer for unknown question {} in chunk {} ignored", candidate.getQuestionId(), chunkId);
            return Outcome.UNKNOWN_QUESTION;
        }

        String subjectId = EventMergeService.resolveRef(workspace, localIds, candidate.getSubjectRef(), chunkId);
        Optional<Question> same = findSame(workspace, subjectId, text);
        if (same.isPresent()) return answer(same.get(), answer, chunkId);

        Question q = Question.builder()
                .id(workspace.allocateQuestionId())
                .subjectId(subjectId)
                .text(text)
                .caseId(caseId)
                .build();
        workspace.getQuestions().put(q.getId(), q);
        if (answer == null) return Outcome.CREATED;
        q.markAnswered(answer, chunkId);
        return Outcome.CREATED_ANSWERED;
    }

    /** @return true when the question existed */
    public boolean drop(Workspace workspace, String questionId) {
        if (StrUtil.isBlank(questionId)) return false;
        return workspace.getQuestions().remove(questionId.trim()) != null;
    }

    private static Outcome answer(Question q, String answer, String chunkId) {
        if (answer == null || q.isAnswered()) return Outcome.UNCHANGED;
        q.markAnswered(answer, chunkId);
        return Outcome.ANSWERED;
    }

    private static Optional<Question> findSame(Workspace workspace, String subjectId, String text) {
        String key = TermUtil.normalize(text);
        return workspace.getQuestions().values().stream()
                .filter(q -> Objects.equals(q.getSubjectId(), subjectId))
                .filter(q -> key.equals(TermUtil.normalize(q.getText())))
                .findFirst();
    }
}
