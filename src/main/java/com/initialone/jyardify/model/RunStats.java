package com.initialone.jyardify.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/** Counters for one generate run; also written into metadata.json. */
public class RunStats {
    public int processed;
    public int failed;
    public int total;

    @JsonProperty("elapsed_time")
    public double elapsedTime;

    public String provider;

    @JsonProperty("failed_files")
    public List<String> failedFiles = new ArrayList<>();
}
