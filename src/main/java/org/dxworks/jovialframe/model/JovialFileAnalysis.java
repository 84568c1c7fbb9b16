package org.dxworks.jovialframe.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

@JsonPropertyOrder({"filePath", "language", "role", "moduleKind", "programName", "compoolDirectives",
        "symbols", "diagnostics", "symbolCount", "occurrenceCount", "unresolvedCount"})
public class JovialFileAnalysis implements Analysis {
    public String filePath;
    public String language = "jovial";
    public String role;
    public String moduleKind;
    public String programName;
    public List<String> compoolDirectives = new ArrayList<>();

    public List<SymbolInfo> symbols = new ArrayList<>();
    public List<DiagnosticInfo> diagnostics = new ArrayList<>();

    public int symbolCount;
    public int occurrenceCount;
    public int unresolvedCount;

    @Override
    public String getFilePath() {
        return filePath;
    }

    @Override
    public String getLanguage() {
        return language;
    }
}
