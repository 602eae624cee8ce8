package org.ticketrouter.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response DTO for GET 3.0/items/geocode of the 2GIS catalog API.
 * Only the fields the engine reads are mapped.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TwoGisGeocodeResponse {

    @JsonProperty("result")
    private ResultDto result;

    public ResultDto getResult() {
        return result;
    }

    public void setResult(ResultDto result) {
        this.result = result;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ResultDto {
        @JsonProperty("items")
        private List<ItemDto> items;

        public List<ItemDto> getItems() {
            return items;
        }

        public void setItems(List<ItemDto> items) {
            this.items = items;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ItemDto {
        @JsonProperty("point")
        private PointDto point;

        @JsonProperty("search_attributes")
        private SearchAttributesDto searchAttributes;

        public PointDto getPoint() {
            return point;
        }

        public void setPoint(PointDto point) {
            this.point = point;
        }

        public SearchAttributesDto getSearchAttributes() {
            return searchAttributes;
        }

        public void setSearchAttributes(SearchAttributesDto searchAttributes) {
            this.searchAttributes = searchAttributes;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class PointDto {
        @JsonProperty("lat")
        private Double lat;

        @JsonProperty("lon")
        private Double lon;

        public Double getLat() {
            return lat;
        }

        public void setLat(Double lat) {
            this.lat = lat;
        }

        public Double getLon() {
            return lon;
        }

        public void setLon(Double lon) {
            this.lon = lon;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class SearchAttributesDto {
        @JsonProperty("precision")
        private String precision;

        public String getPrecision() {
            return precision;
        }

        public void setPrecision(String precision) {
            this.precision = precision;
        }
    }
}
