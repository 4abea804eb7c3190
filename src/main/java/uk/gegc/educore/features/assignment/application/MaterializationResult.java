package uk.gegc.educore.features.assignment.application;

public record MaterializationResult(int lessonCandidates, int lessonCreated, int examCandidates, int examCreated) {

    public static final MaterializationResult EMPTY = new MaterializationResult(0, 0, 0, 0);

    public int created() {
        return lessonCreated + examCreated;
    }

    public int skipped() {
        return (lessonCandidates - lessonCreated) + (examCandidates - examCreated);
    }
}
