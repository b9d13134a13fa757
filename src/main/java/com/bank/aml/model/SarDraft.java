package com.bank.aml.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Draft Suspicious Activity Report, laid out after the standard SAR filing sections.
 */
@Value
@Builder
@Jacksonized
@Schema(description = "Draft Suspicious Activity Report prepared for compliance review")
public class SarDraft {

    @Schema(description = "Account under report", example = "8000EBD30")
    String subjectAccount;

    @Schema(description = "Subject name; never populated, no PII is carried", nullable = true)
    String subjectName;

    @Schema(description = "Institution filing the report", example = "Handle-AI")
    String filingInstitution;

    @Schema(description = "Suspicious activity type", example = "Structuring")
    String activityType;

    @Schema(description = "From the account's first transaction to the screened transaction")
    DateRange activityDateRange;

    @Schema(description = "Historical total sent plus the screened amount", example = "59800.00")
    double totalAmountInvolved;

    @Schema(description = "Brief summary")
    String summary;

    @Schema(description = "Full narrative of the suspicious activity")
    String detailedDescription;

    @Builder.Default
    List<String> transactionIds = List.of();

    @Builder.Default
    List<String> redFlags = List.of();

    @Builder.Default
    List<RegulatoryReference> regulatoryReferences = List.of();

    @Schema(description = "Recommended follow-up", example = "file_sar")
    RecommendedAction recommendedAction;
}
