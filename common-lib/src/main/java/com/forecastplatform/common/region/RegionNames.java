package com.forecastplatform.common.region;

import java.util.Map;

/**
 * Display names of the Brazilian federative units, keyed by their two-letter code.
 */
public final class RegionNames {

    private static final Map<String, String> STATES = Map.ofEntries(
        Map.entry("AC", "Acre"),
        Map.entry("AL", "Alagoas"),
        Map.entry("AP", "Amapá"),
        Map.entry("AM", "Amazonas"),
        Map.entry("BA", "Bahia"),
        Map.entry("CE", "Ceará"),
        Map.entry("DF", "Distrito Federal"),
        Map.entry("ES", "Espírito Santo"),
        Map.entry("GO", "Goiás"),
        Map.entry("MA", "Maranhão"),
        Map.entry("MT", "Mato Grosso"),
        Map.entry("MS", "Mato Grosso do Sul"),
        Map.entry("MG", "Minas Gerais"),
        Map.entry("PA", "Pará"),
        Map.entry("PB", "Paraíba"),
        Map.entry("PR", "Paraná"),
        Map.entry("PE", "Pernambuco"),
        Map.entry("PI", "Piauí"),
        Map.entry("RJ", "Rio de Janeiro"),
        Map.entry("RN", "Rio Grande do Norte"),
        Map.entry("RS", "Rio Grande do Sul"),
        Map.entry("RO", "Rondônia"),
        Map.entry("RR", "Roraima"),
        Map.entry("SC", "Santa Catarina"),
        Map.entry("SP", "São Paulo"),
        Map.entry("SE", "Sergipe"),
        Map.entry("TO", "Tocantins"));

    private RegionNames() {}

    /** Name of the state with this code; unknown codes are returned unchanged. */
    public static String nameOf(String code) {
        if (code == null) return null;
        return STATES.getOrDefault(code, code);
    }
}
