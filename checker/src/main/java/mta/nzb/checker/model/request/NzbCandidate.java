package mta.nzb.checker.model.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * NzbCandidate - DTO for POST /usenet-service/nzb/health
 * Identifies the release whose NZB should be fetched and checked.
 * downloadUrl is preferred; link is the indexer's fallback URL.
 */
public record NzbCandidate(

    @NotBlank(message = "title is required")
    @JsonProperty("title")
    String title,

    @Size(max = 4096, message = "downloadUrl must be at most 4096 characters")
    @JsonProperty("downloadUrl")
    String downloadUrl,

    @Size(max = 4096, message = "link must be at most 4096 characters")
    @JsonProperty("link")
    String link
) {

    public NzbCandidate(String title, String downloadUrl) {
        this(title, downloadUrl, null);
    }

    /**
     * Resolves the URL to fetch: downloadUrl when present, otherwise link.
     *
     * @return trimmed URL, or an empty string when neither is set
     */
    public String resolveUrl() {
        if (downloadUrl != null && !downloadUrl.isBlank()) {
            return downloadUrl.trim();
        }
        return link == null ? "" : link.trim();
    }
}
