package com.flagship.vault_ledger.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Engine settings bound from the {@code ledger.*} namespace.
 */
@ConfigurationProperties(prefix = "ledger")
@Validated
@Getter
@Setter
public class LedgerProperties {

    /**
     * Currency assigned to new vaults when the caller does not pick one.
     */
    @NotBlank
    private String defaultCurrency = "EUR";

    @Valid
    private Pagination pagination = new Pagination();

    @Getter
    @Setter
    public static class Pagination {
        @Min(1)
        private int defaultLimit = 50;

        @Min(1)
        private int maxLimit = 500;
    }
}
