package com.initialone.jyardify.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** On-disk shape of manifest.json. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ManifestData {
    /** path -> entry */
    @JsonProperty("processed_files")
    public Map<String, ManifestEntry> processedFiles = new LinkedHashMap<>();

    @JsonProperty("failed_files")
    public List<String> failedFiles = new ArrayList<>();

    public String timestamp;
}
