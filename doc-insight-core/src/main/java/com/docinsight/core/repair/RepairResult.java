package com.docinsight.core.repair;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Terminal outcome of the repair loop.
 */
public sealed interface RepairResult permits RepairResult.Valid, RepairResult.Failed {

    /**
     * The diagram passed the external syntax check.
     *
     * @param text validated text
     * @param sourceFile checked source file in the scratch workspace
     * @param repairCalls repair calls it took
     */
    record Valid(String text, Path sourceFile, int repairCalls) implements RepairResult {
        public Valid {
            Objects.requireNonNull(text, "text must not be null");
            Objects.requireNonNull(sourceFile, "sourceFile must not be null");
        }
    }

    /**
     * The diagram could not be made valid.
     *
     * @param reason last diagnostic or failure reason
     * @param repairCalls repair calls made before giving up
     */
    record Failed(String reason, int repairCalls) implements RepairResult {
        public Failed {
            Objects.requireNonNull(reason, "reason must not be null");
        }
    }
}
