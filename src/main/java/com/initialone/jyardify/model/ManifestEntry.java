package com.initialone.jyardify.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** One successfully processed source file, as persisted in manifest.json. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ManifestEntry {
    public String timestamp;
    public String provider;

    @JsonProperty("content_hash")
    public String contentHash;

    @JsonProperty("file_name")
    public String fileName;

    public ManifestEntry() {
    }

    public ManifestEntry(String timestamp, String provider, String contentHash, String fileName) {
        this.timestamp = timestamp;
        this.provider = provider;
        this.contentHash = contentHash;
        this.fileName = fileName;
    }
}
