package com.warehouseledger.config;

import com.warehouseledger.model.WarehouseClass;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    @Valid
    @NotEmpty(message = "ledger.warehouses must declare at least one warehouse")
    private List<WarehouseDefinition> warehouses = new ArrayList<>();

    @Valid
    private List<SiteDefinition> sites = new ArrayList<>();

    @Valid
    private DeadStock deadStock = new DeadStock();

    @Min(1)
    private int maxCasesPerRun = 50_000;

    private boolean verifyConsistency = true;

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class WarehouseDefinition {
        @NotBlank
        private String id;
        @NotNull
        private WarehouseClass classification;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SiteDefinition {
        @NotBlank
        private String id;
        private String group;
    }

    @Getter
    @Setter
    public static class DeadStock {
        @NotEmpty
        private List<@Min(1) Integer> thresholds = new ArrayList<>(List.of(90, 180, 365));
        @Min(1)
        private int urgentThresholdDays = 365;
    }
}
