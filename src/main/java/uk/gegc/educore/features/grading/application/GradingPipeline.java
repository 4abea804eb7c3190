package uk.gegc.educore.features.grading.application;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import uk.gegc.educore.features.exam.domain.model.NormalizedExam;
import uk.gegc.educore.features.exam.domain.model.NormalizedQuestion;
import uk.gegc.educore.features.grading.application.grader.GraderFactory;
import uk.gegc.educore.features.grading.application.grader.TextAnswerGrader;
import uk.gegc.educore.features.grading.config.GradingProperties;
import uk.gegc.educore.features.grading.domain.model.GradedQuestion;
import uk.gegc.educore.features.grading.domain.model.GradingOutcome;
import uk.gegc.educore.features.grading.domain.model.GradingSummary;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Grades every question of an exam against a student's answers and aggregates the result.
 * <p>
 * Objective questions are graded inline. Free-text questions go to the external grader
 * one at a time, or in windows of {@code educore.grading.max-concurrent-calls} on the
 * grading executor. Per-question results always come back in exam order.
 */
@Service
@Slf4j
public class GradingPipeline {

    private final GraderFactory graderFactory;
    private final GradingProperties gradingProperties;
    private final Executor gradingTaskExecutor;

    public GradingPipeline(GraderFactory graderFactory,
                           GradingProperties gradingProperties,
                           @Qualifier("gradingTaskExecutor") Executor gradingTaskExecutor) {
        this.graderFactory = graderFactory;
        this.gradingProperties = gradingProperties;
        this.gradingTaskExecutor = gradingTaskExecutor;
    }

    public GradingOutcome grade(NormalizedExam exam, Map<String, JsonNode> answers) {
        List<NormalizedQuestion> questions = exam.questions();
        GradedQuestion[] results = new GradedQuestion[questions.size()];
        List<Integer> subjectiveIndexes = new ArrayList<>();

        int objectiveCount = 0;
        for (int i = 0; i < questions.size(); i++) {
            NormalizedQuestion question = questions.get(i);
            if (question.type().isObjective()) {
                results[i] = gradeOne(question, answers);
                objectiveCount++;
            } else {
                subjectiveIndexes.add(i);
            }
        }

        int window = Math.max(1, gradingProperties.getMaxConcurrentCalls());
        if (window == 1) {
            for (int index : subjectiveIndexes) {
                results[index] = gradeOne(questions.get(index), answers);
            }
        } else {
            gradeInWindows(questions, answers, subjectiveIndexes, window, results);
        }

        List<GradedQuestion> perQuestion = List.of(results);
        int reviewCount = (int) perQuestion.stream().filter(GradedQuestion::needsReview).count();
        int total = perQuestion.stream().mapToInt(GradedQuestion::scorePercent).sum();
        int scorePercent = (int) Math.round((double) total / Math.max(perQuestion.size(), 1));

        GradingSummary summary = new GradingSummary(objectiveCount, subjectiveIndexes.size(), reviewCount);
        log.debug("Graded {} questions: score={}, summary={}", perQuestion.size(), scorePercent, summary);
        return new GradingOutcome(scorePercent, perQuestion, summary);
    }

    private void gradeInWindows(List<NormalizedQuestion> questions, Map<String, JsonNode> answers,
                                List<Integer> subjectiveIndexes, int window, GradedQuestion[] results) {
        for (int start = 0; start < subjectiveIndexes.size(); start += window) {
            List<Integer> batch = subjectiveIndexes.subList(start, Math.min(start + window, subjectiveIndexes.size()));
            List<CompletableFuture<GradedQuestion>> futures = batch.stream()
                    .map(index -> {
                        NormalizedQuestion question = questions.get(index);
                        return CompletableFuture
                                .supplyAsync(() -> gradeOne(question, answers), gradingTaskExecutor)
                                .exceptionally(ex -> {
                                    log.warn("Grading task for question {} failed: {}", question.id(), ex.getMessage());
                                    return GradedQuestion.forReview(question.id(), TextAnswerGrader.UNAVAILABLE_FEEDBACK);
                                });
                    })
                    .toList();
            for (int i = 0; i < batch.size(); i++) {
                results[batch.get(i)] = futures.get(i).join();
            }
        }
    }

    private GradedQuestion gradeOne(NormalizedQuestion question, Map<String, JsonNode> answers) {
        return graderFactory.getGrader(question.type()).grade(question, answers.get(question.id()));
    }
}
