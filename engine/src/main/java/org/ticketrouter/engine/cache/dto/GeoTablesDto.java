package org.ticketrouter.engine.cache.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Contents of geo-tables.json. Coordinates are a list so that file order is the lookup order.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GeoTablesDto {

    @JsonProperty("coordinates")
    private List<PlaceDto> coordinates;

    @JsonProperty("aliases")
    private Map<String, String> aliases;

    @JsonProperty("domestic_countries")
    private List<String> domesticCountries;

    public List<PlaceDto> getCoordinates() {
        return coordinates;
    }

    public void setCoordinates(List<PlaceDto> coordinates) {
        this.coordinates = coordinates;
    }

    public Map<String, String> getAliases() {
        return aliases;
    }

    public void setAliases(Map<String, String> aliases) {
        this.aliases = aliases;
    }

    public List<String> getDomesticCountries() {
        return domesticCountries;
    }

    public void setDomesticCountries(List<String> domesticCountries) {
        this.domesticCountries = domesticCountries;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class PlaceDto {
        @JsonProperty("name")
        private String name;

        @JsonProperty("lat")
        private double lat;

        @JsonProperty("lon")
        private double lon;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public double getLat() {
            return lat;
        }

        public void setLat(double lat) {
            this.lat = lat;
        }

        public double getLon() {
            return lon;
        }

        public void setLon(double lon) {
            this.lon = lon;
        }
    }
}
