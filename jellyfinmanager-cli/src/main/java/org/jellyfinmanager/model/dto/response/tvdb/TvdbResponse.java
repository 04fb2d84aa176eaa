package org.jellyfinmanager.model.dto.response.tvdb;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope shared by all TVDB v4 responses.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TvdbResponse<T> {

    private T data;
    private String status;
    private Links links;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Links {
        private String prev;
        private String self;
        private String next;
        private Integer totalItems;
        private Integer pageSize;
    }

    public boolean hasNextPage() {
        return links != null && links.getNext() != null && !links.getNext().isBlank();
    }
}
