package com.pipewright.core.state;

import java.util.List;
import java.util.Map;

/**
 * Decides whether recorded output is still valid. Side-effect free: all file system
 * state arrives as an {@link OutputFingerprint}.
 *
 * <p>Checks run in a fixed order and the first one that fails decides:
 * <ol>
 *   <li>no record for the task</li>
 *   <li>output file missing</li>
 *   <li>output content differs from the recorded hash</li>
 *   <li>input hash changed</li>
 *   <li>configuration hash changed</li>
 *   <li>a dependency has no record, or its output hash differs from the snapshot</li>
 * </ol>
 */
public final class RegenerationPolicy {

    private RegenerationPolicy() {}

    public static RegenerationDecision evaluate(String currentInputHash,
                                                String currentConfigHash,
                                                TaskOutputRecord record,
                                                OutputFingerprint currentOutput,
                                                List<String> dependencies,
                                                Map<String, TaskOutputRecord> currentRecords) {
        if (record == null) {
            return RegenerationDecision.regenerate("no previous output recorded");
        }
        if (!currentOutput.exists()) {
            return RegenerationDecision.regenerate("output file does not exist");
        }
        if (currentOutput.error() != null) {
            return RegenerationDecision.regenerate("failed to hash current output: " + currentOutput.error());
        }
        if (!currentOutput.hash().equals(record.outputHash())) {
            return RegenerationDecision.regenerate("output file was modified externally");
        }
        if (!equal(currentInputHash, record.inputHashAtGeneration())) {
            return RegenerationDecision.regenerate("input files changed");
        }
        if (!equal(currentConfigHash, record.configHashAtGeneration())) {
            return RegenerationDecision.regenerate("configuration changed");
        }

        for (String dep : dependencies) {
            TaskOutputRecord depRecord = currentRecords.get(dep);
            if (depRecord == null) {
                return RegenerationDecision.regenerate("dependency " + dep + " has no recorded output");
            }
            String snapshot = record.dependencyHashes().get(dep);
            if (snapshot == null) {
                return RegenerationDecision.regenerate("dependency " + dep + " was not recorded at generation time");
            }
            if (!snapshot.equals(depRecord.outputHash())) {
                return RegenerationDecision.regenerate("dependency " + dep + " output changed");
            }
        }

        return RegenerationDecision.upToDate();
    }

    private static boolean equal(String a, String b) {
        return (a == null ? "" : a).equals(b == null ? "" : b);
    }
}
