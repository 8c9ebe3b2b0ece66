package foldrun.coordinator.model;

import java.util.regex.Pattern;

/**
 * Job id syntax. Ids become directory names in the job store, so they are
 * restricted to a portable file-name alphabet.
 */
public final class JobIds {

    private static final Pattern VALID = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9._-]{0,127}$");

    private JobIds() {
    }

    public static boolean isValid(String jobId) {
        return jobId != null && VALID.matcher(jobId).matches();
    }

    public static String requireValid(String jobId) {
        if (!isValid(jobId)) {
            throw new JobValidationException(
                    "jobId must be 1-128 characters of letters, digits, '.', '_' or '-' and start with a letter or digit");
        }
        return jobId;
    }
}
