package ru.oparin.fpthemes.model.enums;

/**
 * Этапы диалога загрузки темы. Переходы только вперед, назад только через новую загрузку.
 */
public enum SubmissionStage {
    AWAITING_FILE,
    AWAITING_NAME,
    AWAITING_DESCRIPTION,
    AWAITING_VISIBILITY,
    FINALIZING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
