package org.ticketrouter.engine.batch.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.ticketrouter.engine.domain.model.Language;
import org.ticketrouter.engine.domain.model.Segment;
import org.ticketrouter.engine.domain.model.Sentiment;
import org.ticketrouter.engine.domain.model.TicketAttributes;
import org.ticketrouter.engine.domain.model.TicketType;

/**
 * Classified ticket as read from the host's input file.
 * Enum fields accept either the enum name or the Russian label.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TicketDto {

    @JsonProperty("ticket_id")
    private String ticketId;

    @JsonProperty("segment")
    private String segment;

    @JsonProperty("ticket_type")
    private String ticketType;

    @JsonProperty("sentiment")
    private String sentiment;

    @JsonProperty("language")
    private String language;

    @JsonProperty("country")
    private String country;

    @JsonProperty("region")
    private String region;

    @JsonProperty("city")
    private String city;

    @JsonProperty("street")
    private String street;

    @JsonProperty("house")
    private String house;

    public TicketAttributes toAttributes() {
        return new TicketAttributes.Builder()
                .ticketId(ticketId)
                .segment(Segment.fromLabel(segment))
                .ticketType(TicketType.fromLabel(ticketType))
                .sentiment(Sentiment.fromLabel(sentiment))
                .language(Language.fromLabel(language))
                .country(country)
                .region(region)
                .city(city)
                .street(street)
                .house(house)
                .build();
    }

    public String getTicketId() {
        return ticketId;
    }

    public void setTicketId(String ticketId) {
        this.ticketId = ticketId;
    }

    public String getSegment() {
        return segment;
    }

    public void setSegment(String segment) {
        this.segment = segment;
    }

    public String getTicketType() {
        return ticketType;
    }

    public void setTicketType(String ticketType) {
        this.ticketType = ticketType;
    }

    public String getSentiment() {
        return sentiment;
    }

    public void setSentiment(String sentiment) {
        this.sentiment = sentiment;
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }

    public String getCountry() {
        return country;
    }

    public void setCountry(String country) {
        this.country = country;
    }

    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }

    public String getCity() {
        return city;
    }

    public void setCity(String city) {
        this.city = city;
    }

    public String getStreet() {
        return street;
    }

    public void setStreet(String street) {
        this.street = street;
    }

    public String getHouse() {
        return house;
    }

    public void setHouse(String house) {
        this.house = house;
    }
}
