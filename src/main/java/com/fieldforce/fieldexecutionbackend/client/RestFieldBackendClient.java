package com.fieldforce.fieldexecutionbackend.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.datatype.jsr310.deser.LocalDateTimeDeserializer;
import com.fieldforce.fieldexecutionbackend.config.FieldExecutionProperties;
import com.fieldforce.fieldexecutionbackend.dto.FinalizeResponse;
import com.fieldforce.fieldexecutionbackend.dto.ItemCheckUpdate;
import com.fieldforce.fieldexecutionbackend.dto.UnplannedStopRequest;
import com.fieldforce.fieldexecutionbackend.exception.BackendRejectedException;
import com.fieldforce.fieldexecutionbackend.exception.BackendUnavailableException;
import com.fieldforce.fieldexecutionbackend.exception.FieldBackendException;
import com.fieldforce.fieldexecutionbackend.model.GeoPoint;
import com.fieldforce.fieldexecutionbackend.model.MediaRef;
import com.fieldforce.fieldexecutionbackend.model.Route;
import com.fieldforce.fieldexecutionbackend.model.Transfer;
import com.fieldforce.fieldexecutionbackend.model.TransferItemCheck;
import com.fieldforce.fieldexecutionbackend.model.Visit;
import com.fieldforce.fieldexecutionbackend.model.result.ActivityResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Frappe-style client: every operation is {@code POST {base-url}/api/method/<method>} with a JSON
 * body, and the payload comes back wrapped in {@code {"message": ...}}.
 */
@Slf4j
@Component
public class RestFieldBackendClient implements FieldBackendClient {

    static final String ROUTE_API = "frm.api.route.";
    static final String VISIT_API = "frm.api.visit.";
    static final String PHOTO_API = "frm.api.photo.";
    static final String TRANSFER_API = "frm.api.stock_transfer.";
    static final String UPLOAD_FILE = "upload_file";

    // Frappe writes "2024-05-01 08:30:00.123456"
    private static final DateTimeFormatter BACKEND_DATE_TIME = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd")
            .optionalStart().appendLiteral(' ').optionalEnd()
            .optionalStart().appendLiteral('T').optionalEnd()
            .appendPattern("HH:mm:ss")
            .optionalStart().appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd()
            .toFormatter();

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    public RestFieldBackendClient(RestTemplate restTemplate, FieldExecutionProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = createBackendObjectMapper();
        this.baseUrl = stripTrailingSlash(properties.getBackend().getBaseUrl());
    }

    public static ObjectMapper createBackendObjectMapper() {
        JavaTimeModule timeModule = new JavaTimeModule();
        timeModule.addDeserializer(LocalDateTime.class, new LocalDateTimeDeserializer(BACKEND_DATE_TIME));

        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(timeModule);
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.enable(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT);
        return mapper;
    }

    // ---------------------------------------------------------------- routes

    @Override
    public Optional<Route> getTodaysRoute(String agentId) {
        JsonNode message = call(ROUTE_API + "get_todays_route", params("agent", agentId));
        JsonNode routeNode = unwrap(message, "route");
        // "no route today" comes back as {route: null, message: "..."}
        if (routeNode == null || routeNode.isNull() || !routeNode.has("stops")) {
            return Optional.empty();
        }
        return Optional.of(convert(routeNode, Route.class, "get_todays_route"));
    }

    @Override
    public Route getRoute(String routeId) {
        JsonNode message = call(ROUTE_API + "get_route_execution", params("route_name", routeId));
        return toRoute(message, "get_route_execution");
    }

    @Override
    public Route startRoute(String routeId, GeoPoint location) {
        Map<String, Object> body = params("route_name", routeId);
        putLocation(body, location);
        return toRoute(call(ROUTE_API + "start_route_execution", body), "start_route_execution");
    }

    @Override
    public Route endRoute(String routeId, GeoPoint location, String notes) {
        Map<String, Object> body = params("route_name", routeId);
        putLocation(body, location);
        if (notes != null) {
            body.put("notes", notes);
        }
        return toRoute(call(ROUTE_API + "end_route_execution", body), "end_route_execution");
    }

    @Override
    public Route arriveAtStop(String routeId, int stopIdx, GeoPoint location) {
        Map<String, Object> body = stopStatus(routeId, stopIdx, "arrived");
        putLocation(body, location);
        return toRoute(call(ROUTE_API + "update_route_stop_status", body), "update_route_stop_status");
    }

    @Override
    public Route completeStop(String routeId, int stopIdx) {
        Map<String, Object> body = stopStatus(routeId, stopIdx, "completed");
        return toRoute(call(ROUTE_API + "update_route_stop_status", body), "update_route_stop_status");
    }

    @Override
    public Route skipStop(String routeId, int stopIdx, String reason) {
        Map<String, Object> body = stopStatus(routeId, stopIdx, "skipped");
        body.put("skip_reason", reason);
        return toRoute(call(ROUTE_API + "update_route_stop_status", body), "update_route_stop_status");
    }

    @Override
    public Route addUnplannedStop(String routeId, UnplannedStopRequest stop) {
        Map<String, Object> body = params("route_name", routeId);
        body.put("stop_type", stop.getKind().getBackendLabel());
        body.put("stop_name", stop.getStopName());
        body.put("customer", stop.getCustomer());
        body.put("warehouse", stop.getWarehouse());
        body.put("latitude", stop.getLatitude());
        body.put("longitude", stop.getLongitude());
        body.put("unplanned_reason", stop.getReason());
        body.put("notes", stop.getNotes());
        return toRoute(call(ROUTE_API + "add_unplanned_stop", body), "add_unplanned_stop");
    }

    // ---------------------------------------------------------------- visits

    @Override
    public Visit getVisit(String visitId) {
        JsonNode message = call(VISIT_API + "get_visit_details", params("sales_visit", visitId));
        return convert(unwrap(message, "visit"), Visit.class, "get_visit_details");
    }

    @Override
    public void markActivityCompleted(String visitId, String activityType, String activityName,
                                      String status, ActivityResult result) {
        Map<String, Object> body = params("sales_visit", visitId);
        body.put("activity_type", activityType);
        body.put("activity_name", activityName);
        if (status != null) {
            body.put("status", status);
        }
        body.put("result_data", writeJson(result, "mark_activity_completed"));
        call(VISIT_API + "mark_activity_completed", body);
    }

    @Override
    public List<MediaRef> getVisitMedia(String visitId) {
        JsonNode message = call(PHOTO_API + "get_visit_photos", params("sales_visit", visitId));
        List<MediaRef> media = new ArrayList<>();
        if (message == null || !message.isArray()) {
            return media;
        }
        for (JsonNode item : message) {
            if (item.isTextual()) {
                // Older backends answer with bare file URLs
                media.add(new MediaRef(item.asText(), item.asText(), null, null));
            } else {
                MediaRef ref = convert(item, MediaRef.class, "get_visit_photos");
                if (ref.getId() == null) {
                    ref.setId(ref.getUrl() != null ? ref.getUrl() : item.path("name").asText(null));
                }
                if (ref.getUrl() == null) {
                    ref.setUrl(item.path("file_url").asText(null));
                }
                media.add(ref);
            }
        }
        return media;
    }

    @Override
    public void attachVisitMedia(String visitId, List<MediaRef> media) {
        Map<String, Object> body = params("sales_visit", visitId);
        body.put("file_urls", media.stream().map(MediaRef::getUrl).toList());
        call(PHOTO_API + "attach_photos_to_visit", body);
    }

    @Override
    public FinalizeResponse finalizeVisit(String visitId) {
        JsonNode message = call(VISIT_API + "complete", params("sales_visit", visitId));
        if (message == null || message.isNull() || !message.isObject()) {
            return new FinalizeResponse();
        }
        return convert(message, FinalizeResponse.class, "complete");
    }

    // ---------------------------------------------------------------- transfers

    @Override
    public Transfer getTransferDetail(String transferId) {
        JsonNode message = call(TRANSFER_API + "get_transfer_detail", params("transfer_id", transferId));
        if (message == null || message.isNull()) {
            throw new FieldBackendException("get_transfer_detail", "Empty transfer detail for " + transferId, null);
        }
        JsonNode transferNode = unwrap(message, "transfer");
        Transfer transfer = convert(transferNode, Transfer.class, "get_transfer_detail");

        // Items may be grouped per delivery order next to the transfer document
        if ((transfer.getItems() == null || transfer.getItems().isEmpty()) && message.has("items_by_delivery")) {
            List<TransferItemCheck> items = new ArrayList<>();
            for (JsonNode group : message.path("items_by_delivery")) {
                String deliveryOrder = group.path("delivery_order").asText(null);
                for (JsonNode itemNode : group.path("items")) {
                    TransferItemCheck item = convert(itemNode, TransferItemCheck.class, "get_transfer_detail");
                    if (item.getDeliveryOrder() == null) {
                        item.setDeliveryOrder(deliveryOrder);
                    }
                    items.add(item);
                }
            }
            transfer.setItems(items);
        }
        if (message.has("linked_deliveries") && message.path("linked_deliveries").isArray()) {
            List<String> deliveries = new ArrayList<>();
            for (JsonNode delivery : message.path("linked_deliveries")) {
                deliveries.add(delivery.isTextual() ? delivery.asText() : delivery.path("name").asText());
            }
            transfer.setLinkedDeliveries(deliveries);
        }
        return transfer;
    }

    @Override
    public void startLoadingCheck(String transferId) {
        call(TRANSFER_API + "start_loading_check", params("transfer_id", transferId));
    }

    @Override
    public void updateItemCheck(String transferId, ItemCheckUpdate update) {
        Map<String, Object> body = params("transfer_id", transferId);
        body.put("product_code", update.getProductCode());
        body.put("verified_qty", update.getVerifiedQty());
        body.put("damaged_qty", update.getDamagedQty());
        body.put("missing_qty", update.getMissingQty());
        body.put("rejected", update.isRejected() ? 1 : 0);
        call(TRANSFER_API + "update_item_check", body);
    }

    @Override
    public void verifyAllItems(String transferId) {
        call(TRANSFER_API + "verify_all_items", params("transfer_id", transferId));
    }

    @Override
    public void completeLoading(String transferId) {
        call(TRANSFER_API + "complete_loading", params("transfer_id", transferId));
    }

    @Override
    public void arriveAtDestination(String transferId, GeoPoint location) {
        Map<String, Object> body = params("transfer_id", transferId);
        if (location != null && location.isKnown()) {
            putLocation(body, location);
        }
        call(TRANSFER_API + "arrive_at_dc", body);
    }

    @Override
    public String uploadTransferPhoto(String transferId, String fileName, String base64Content) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("doctype", "Stock Transfer");
        body.put("docname", transferId);
        body.put("fieldname", "handoff_photo");
        body.put("filename", fileName != null ? fileName : transferId + "-handoff.jpg");
        body.put("filedata", base64Content);
        body.put("decode_base64", 1);
        body.put("is_private", 0);
        JsonNode message = call(UPLOAD_FILE, body);
        String url = message == null ? null : message.path("file_url").asText(null);
        if (url == null) {
            throw new FieldBackendException(UPLOAD_FILE, "Upload returned no file_url for " + transferId, null);
        }
        return url;
    }

    @Override
    public void completeHandoff(String transferId, String receivedBy, String photoUrl, String notes) {
        Map<String, Object> body = params("transfer_id", transferId);
        body.put("received_by", receivedBy);
        if (photoUrl != null) {
            body.put("handoff_photo", photoUrl);
        }
        if (notes != null) {
            body.put("handoff_notes", notes);
        }
        call(TRANSFER_API + "complete_handoff", body);
    }

    @Override
    public void returnTransfer(String transferId, String reason) {
        Map<String, Object> body = params("transfer_id", transferId);
        body.put("reason", reason);
        call(TRANSFER_API + "return_transfer", body);
    }

    // ---------------------------------------------------------------- plumbing

    /**
     * Posts to a whitelisted method and returns the unwrapped {@code message} node
     * (may be {@code null} for void methods).
     */
    JsonNode call(String method, Map<String, Object> body) {
        String url = baseUrl + "/api/method/" + method;
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);
        } catch (ResourceAccessException e) {
            throw new BackendUnavailableException(method, "I/O error calling " + method + ": " + e.getMessage(), e);
        } catch (HttpServerErrorException e) {
            int status = e.getStatusCode().value();
            if (status == 502 || status == 503 || status == 504) {
                throw new BackendUnavailableException(method, method + " returned " + status, e);
            }
            throw new FieldBackendException(method, method + " failed with " + status, e);
        } catch (HttpClientErrorException e) {
            throw new BackendRejectedException(method, e.getStatusCode().value(),
                    extractServerMessage(e.getResponseBodyAsString(), e.getStatusText()), e);
        } catch (RestClientException e) {
            throw new FieldBackendException(method, "Unexpected error calling " + method, e);
        }

        String payload = response.getBody();
        if (payload == null || payload.isBlank()) {
            return null;
        }
        try {
            JsonNode root = objectMapper.readTree(payload);
            JsonNode message = root.get("message");
            log.debug("{} -> {}", method, response.getStatusCode());
            return message;
        } catch (JsonProcessingException e) {
            throw new FieldBackendException(method, "Unreadable response from " + method, e);
        }
    }

    /**
     * Frappe puts the human-readable reason in {@code _server_messages} (a JSON-encoded array of
     * JSON-encoded objects), {@code message} or {@code exception}.
     */
    String extractServerMessage(String body, String fallback) {
        if (body == null || body.isBlank()) {
            return fallback;
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root.hasNonNull("_server_messages")) {
                JsonNode messages = objectMapper.readTree(root.get("_server_messages").asText());
                if (messages.isArray() && messages.size() > 0) {
                    JsonNode first = messages.get(0);
                    if (first.isTextual()) {
                        JsonNode decoded = objectMapper.readTree(first.asText());
                        return decoded.path("message").asText(first.asText());
                    }
                    return first.path("message").asText(fallback);
                }
            }
            if (root.hasNonNull("message") && root.get("message").isTextual()) {
                return root.get("message").asText();
            }
            if (root.hasNonNull("exception")) {
                return root.get("exception").asText();
            }
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: {}", e.getMessage());
        }
        return fallback;
    }

    private Route toRoute(JsonNode message, String method) {
        JsonNode routeNode = unwrap(message, "route");
        if (routeNode == null || routeNode.isNull()) {
            throw new FieldBackendException(method, method + " returned no route", null);
        }
        return convert(routeNode, Route.class, method);
    }

    private JsonNode unwrap(JsonNode message, String field) {
        if (message != null && message.isObject() && message.has(field)) {
            JsonNode inner = message.get(field);
            if (inner.isObject() || inner.isNull()) {
                return inner;
            }
        }
        return message;
    }

    private <T> T convert(JsonNode node, Class<T> type, String method) {
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new FieldBackendException(method, "Cannot read " + type.getSimpleName() + " from " + method, e);
        }
    }

    private String writeJson(Object value, String method) {
        if (value == null) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new FieldBackendException(method, "Cannot serialize payload for " + method, e);
        }
    }

    private Map<String, Object> params(String key, Object value) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(key, value);
        return body;
    }

    private Map<String, Object> stopStatus(String routeId, int stopIdx, String status) {
        Map<String, Object> body = params("route_name", routeId);
        body.put("stop_idx", stopIdx);
        body.put("status", status);
        return body;
    }

    private void putLocation(Map<String, Object> body, GeoPoint location) {
        GeoPoint point = location != null ? location : GeoPoint.unknown();
        body.put("latitude", point.getLatitude());
        body.put("longitude", point.getLongitude());
    }

    private static String stripTrailingSlash(String url) {
        if (url != null && url.endsWith("/")) {
            return url.substring(0, url.length() - 1);
        }
        return url;
    }
}
