package com.anthem.acctctl.gateway.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AccountCredentials {

    private String accountId;
    private String name;
    private String accessKeyId;
    private String secretAccessKey;
    private String sessionToken;
    private Instant expires;
    private String error;
}
