package net.pagewise.core.error;

import net.pagewise.core.model.JobType;

public class UnsupportedJobTypeException extends Exception {
    public UnsupportedJobTypeException(JobType jobType, String source) {
        super(source + " does not support job type " + jobType.code());
    }
}
