package com.anthem.acctctl.gateway.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of account update calls. Null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateRequest {

    private String description;
    private String owner;

    /** Comma-separated tags, {@code !} prefix clears a tag. */
    private String tags;
}
