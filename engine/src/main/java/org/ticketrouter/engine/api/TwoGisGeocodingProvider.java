package org.ticketrouter.engine.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.ticketrouter.engine.api.dto.TwoGisGeocodeResponse;
import org.ticketrouter.engine.domain.model.GeoPoint;
import retrofit2.Call;
import retrofit2.Response;
import retrofit2.Retrofit;
import retrofit2.converter.jackson.JacksonConverterFactory;
import retrofit2.http.GET;
import retrofit2.http.Query;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Retrofit-based client for the 2GIS geocoder.
 * Docs: https://docs.2gis.com/en/api/search/geocoder/reference/3.0/items/geocode
 */
public final class TwoGisGeocodingProvider implements GeocodingProvider {

    private static final Logger log = LoggerFactory.getLogger(TwoGisGeocodingProvider.class);

    private static final String FIELDS = "items.point,items.search_attributes";

    private final TwoGisApi api;
    private final String apiKey;
    private final String locale;

    public TwoGisGeocodingProvider(String baseUrl, String apiKey, String locale, int timeoutSeconds) {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey must not be null");
        this.locale = Objects.requireNonNull(locale, "locale must not be null");

        String normalizedUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";

        OkHttpClient client = new OkHttpClient.Builder()
                .connectTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .callTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .build();

        Retrofit retrofit = new Retrofit.Builder()
                .baseUrl(normalizedUrl)
                .addConverterFactory(JacksonConverterFactory.create(new ObjectMapper()))
                .client(client)
                .build();

        this.api = retrofit.create(TwoGisApi.class);
        log.info("2GIS geocoder configured: {} (locale={})", normalizedUrl, locale);
    }

    @Override
    public Optional<GeoPoint> query(String query) throws GeocodingException {
        Response<TwoGisGeocodeResponse> response;
        try {
            response = api.geocode(apiKey, query, FIELDS, locale).execute();
        } catch (IOException e) {
            throw new GeocodingException("2GIS request failed for '" + query + "'", e);
        } catch (RuntimeException e) {
            throw new GeocodingException("2GIS response unreadable for '" + query + "'", e);
        }

        if (!response.isSuccessful()) {
            throw new GeocodingException(String.format("2GIS returned %d %s for '%s'",
                    response.code(), response.message(), query));
        }

        TwoGisGeocodeResponse body = response.body();
        if (body == null || body.getResult() == null) {
            log.debug("2GIS: no result for '{}'", query);
            return Optional.empty();
        }
        List<TwoGisGeocodeResponse.ItemDto> items = body.getResult().getItems();
        if (items == null || items.isEmpty()) {
            log.debug("2GIS: no items for '{}'", query);
            return Optional.empty();
        }

        TwoGisGeocodeResponse.ItemDto first = items.get(0);
        TwoGisGeocodeResponse.PointDto point = first.getPoint();
        if (point == null || point.getLat() == null || point.getLon() == null) {
            return Optional.empty();
        }

        GeoPoint result;
        try {
            result = new GeoPoint(point.getLat(), point.getLon());
        } catch (IllegalArgumentException e) {
            throw new GeocodingException("2GIS returned invalid coordinates for '" + query + "'", e);
        }
        String precision = first.getSearchAttributes() != null ? first.getSearchAttributes().getPrecision() : null;
        log.info("2GIS (precision={}): '{}' -> {}", precision != null ? precision : "n/a", query, result);
        return Optional.of(result);
    }

    /**
     * Retrofit service interface for the 2GIS catalog API.
     */
    interface TwoGisApi {
        @GET("3.0/items/geocode")
        Call<TwoGisGeocodeResponse> geocode(@Query("key") String key,
                                            @Query("q") String query,
                                            @Query("fields") String fields,
                                            @Query("locale") String locale);
    }
}
