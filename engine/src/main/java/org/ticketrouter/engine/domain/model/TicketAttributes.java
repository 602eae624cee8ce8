package org.ticketrouter.engine.domain.model;

import java.util.Objects;

/**
 * Classified ticket as handed to the engine. Immutable.
 * Location fields are optional and kept exactly as received.
 */
public final class TicketAttributes {

    private final String ticketId;
    private final Segment segment;
    private final TicketType ticketType;
    private final Sentiment sentiment;
    private final Language language;
    private final String country;
    private final String region;
    private final String city;
    private final String street;
    private final String house;

    private TicketAttributes(Builder builder) {
        this.ticketId = Objects.requireNonNull(builder.ticketId, "ticketId must not be null");
        this.segment = Objects.requireNonNull(builder.segment, "segment must not be null");
        this.ticketType = Objects.requireNonNull(builder.ticketType, "ticketType must not be null");
        this.sentiment = Objects.requireNonNull(builder.sentiment, "sentiment must not be null");
        this.language = Objects.requireNonNull(builder.language, "language must not be null");
        this.country = builder.country;
        this.region = builder.region;
        this.city = builder.city;
        this.street = builder.street;
        this.house = builder.house;
    }

    public String getTicketId() {
        return ticketId;
    }

    public Segment getSegment() {
        return segment;
    }

    public TicketType getTicketType() {
        return ticketType;
    }

    public Sentiment getSentiment() {
        return sentiment;
    }

    public Language getLanguage() {
        return language;
    }

    public String getCountry() {
        return country;
    }

    public String getRegion() {
        return region;
    }

    public String getCity() {
        return city;
    }

    public String getStreet() {
        return street;
    }

    public String getHouse() {
        return house;
    }

    public boolean isSpam() {
        return ticketType == TicketType.SPAM;
    }

    @Override
    public String toString() {
        return String.format("Ticket{id='%s', segment=%s, type=%s, sentiment=%s, language=%s, city='%s', region='%s'}",
                ticketId, segment, ticketType, sentiment, language, city, region);
    }

    /**
     * Builder for TicketAttributes.
     */
    public static final class Builder {
        private String ticketId;
        private Segment segment = Segment.MASS;
        private TicketType ticketType = TicketType.CONSULTATION;
        private Sentiment sentiment = Sentiment.NEUTRAL;
        private Language language = Language.RU;
        private String country;
        private String region;
        private String city;
        private String street;
        private String house;

        public Builder ticketId(String ticketId) {
            this.ticketId = ticketId;
            return this;
        }

        public Builder segment(Segment segment) {
            this.segment = segment;
            return this;
        }

        public Builder ticketType(TicketType ticketType) {
            this.ticketType = ticketType;
            return this;
        }

        public Builder sentiment(Sentiment sentiment) {
            this.sentiment = sentiment;
            return this;
        }

        public Builder language(Language language) {
            this.language = language;
            return this;
        }

        public Builder country(String country) {
            this.country = country;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder city(String city) {
            this.city = city;
            return this;
        }

        public Builder street(String street) {
            this.street = street;
            return this;
        }

        public Builder house(String house) {
            this.house = house;
            return this;
        }

        public TicketAttributes build() {
            return new TicketAttributes(this);
        }
    }
}
