package com.fxledger.api.dto.request;

import com.fxledger.domain.model.RawTable;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A spreadsheet-like table as posted by the client: header names plus rows keyed by header.
 *
 * <p>{@code columns} may be omitted, in which case the headers are taken from the rows.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RawTableRequest {

    private List<String> columns;

    @NotNull(message = "rows are required")
    private List<Map<String, String>> rows;

    public RawTable toRawTable() {
        return RawTable.of(columns, rows);
    }
}
