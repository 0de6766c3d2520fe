package com.finchat.rag.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Request model for /rag/ask, /rag/route and /rag/search.
 */
@Data
public class AskRequest {
    @NotBlank(message = "Question is required")
    private String question;

    private String userId;
    private Integer topK;
}
