package com.bank.aml.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@Schema(description = "Inclusive time range in epoch milliseconds")
public class DateRange {

    @Schema(description = "Range start (epoch ms)")
    long start;

    @Schema(description = "Range end (epoch ms)")
    long end;
}
