package com.PayRecon.recon_backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "recon")
@Data
public class ReconciliationProperties {

    private String timezone = "Australia/Brisbane";

    // Ledger account carrying labour debits in the journal batch
    private String labourLedgerAccount = "-6345";

    private String virtualSplitPrefix = "SPL-";

    private String costAccountPattern = "^[0-9]+-[0-9]+$";

    private long lockWaitSeconds = 30;

    private Tolerance tolerance = new Tolerance();

    private Allocation allocation = new Allocation();

    private TransactionTypes transactionTypes = new TransactionTypes();

    private Accrual accrual = new Accrual();

    @Data
    public static class Tolerance {
        private BigDecimal hours = new BigDecimal("1");
        private BigDecimal hoursCritical = new BigDecimal("8");
        private BigDecimal costAbsolute = new BigDecimal("10");
        private BigDecimal costPercent = new BigDecimal("1");
        private BigDecimal costCriticalPercent = new BigDecimal("5");
        private BigDecimal costCenterAbsolute = new BigDecimal("10");
        private BigDecimal costCenterPercent = new BigDecimal("1");
        private BigDecimal costCenterCriticalPercent = new BigDecimal("5");
    }

    @Data
    public static class Allocation {
        private BigDecimal percentageTolerance = new BigDecimal("0.05");
        private List<String> excludedTransactionTypes = new ArrayList<>(List.of("Tax", "Net Pay"));
    }

    /**
     * Fallback inclusion lists used while the transaction type table is empty.
     */
    @Data
    public static class TransactionTypes {
        private List<String> hours = new ArrayList<>(List.of(
                "Annual Leave", "Auto Pay", "Hours By Rate", "Long Service Leave", "Other Leave",
                "Sick Leave", "Term Post 93 AL Gross", "Term Post 93 LL Gross", "User Defined Leave"));
        private List<String> costs = new ArrayList<>(List.of(
                "Annual Leave", "Auto Pay", "Hours By Rate", "Long Service Leave", "Non Standard Add Before",
                "Other Leave", "Sick Leave", "Standard Add Before", "Super", "Term ETP - Taxable (Code: O)",
                "Term Post 93 AL Gross", "Term Post 93 LL Gross", "User Defined Leave"));
    }

    @Data
    public static class Accrual {
        private BigDecimal superannuationRate = new BigDecimal("0.12");
        private BigDecimal annualLeaveRate = new BigDecimal("0.077");
        private BigDecimal payrollTaxRate = new BigDecimal("0.0495");
        private BigDecimal workcoverRate = new BigDecimal("0.01384");
        private int fortnightDays = 14;
    }
}
