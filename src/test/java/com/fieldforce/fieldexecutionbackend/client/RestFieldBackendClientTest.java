package com.fieldforce.fieldexecutionbackend.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldforce.fieldexecutionbackend.config.FieldExecutionProperties;
import com.fieldforce.fieldexecutionbackend.dto.FinalizeResponse;
import com.fieldforce.fieldexecutionbackend.exception.BackendRejectedException;
import com.fieldforce.fieldexecutionbackend.exception.BackendUnavailableException;
import com.fieldforce.fieldexecutionbackend.exception.FieldBackendException;
import com.fieldforce.fieldexecutionbackend.model.ActivityStatus;
import com.fieldforce.fieldexecutionbackend.model.ActivityType;
import com.fieldforce.fieldexecutionbackend.model.GeoPoint;
import com.fieldforce.fieldexecutionbackend.model.ItemCheckStatus;
import com.fieldforce.fieldexecutionbackend.model.MediaRef;
import com.fieldforce.fieldexecutionbackend.model.Route;
import com.fieldforce.fieldexecutionbackend.model.RouteStatus;
import com.fieldforce.fieldexecutionbackend.model.StopKind;
import com.fieldforce.fieldexecutionbackend.model.StopStatus;
import com.fieldforce.fieldexecutionbackend.model.Transfer;
import com.fieldforce.fieldexecutionbackend.model.TransferStatus;
import com.fieldforce.fieldexecutionbackend.model.Visit;
import com.fieldforce.fieldexecutionbackend.model.VisitStatus;
import com.fieldforce.fieldexecutionbackend.model.result.OrderResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RestFieldBackendClientTest {

    private static final String BASE = "http://backend.test/api/method/";

    private MockRestServiceServer server;
    private RestFieldBackendClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        FieldExecutionProperties properties = new FieldExecutionProperties();
        properties.getBackend().setBaseUrl("http://backend.test/");
        client = new RestFieldBackendClient(restTemplate, properties);
    }

    @Test
    void testGetTodaysRoute() {
        server.expect(requestTo(BASE + "frm.api.route.get_todays_route"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.agent").value("agent-7"))
                .andRespond(withSuccess("""
                        {"message": {"route": {
                          "name": "ROUTE-2024-0001",
                          "route_date": "2024-05-01",
                          "status": "in_progress",
                          "start_time": "2024-05-01 08:02:11.482913",
                          "stops": [
                            {"idx": 1, "sequence": 1, "stop_type": "Sales Visit", "status": "completed",
                             "sales_visit": "VISIT-1", "customer": "CUST-1", "customer_name": "Toko Makmur"},
                            {"idx": 2, "sequence": 2, "stop_type": "Stock Transfer", "status": "pending",
                             "stock_transfer": "STE-0001"}
                          ]}}}
                        """, MediaType.APPLICATION_JSON));

        Optional<Route> route = client.getTodaysRoute("agent-7");

        server.verify();
        assertTrue(route.isPresent());
        assertEquals("ROUTE-2024-0001", route.get().getId());
        assertEquals(LocalDate.of(2024, 5, 1), route.get().getRouteDate());
        assertEquals(RouteStatus.IN_PROGRESS, route.get().getStatus());
        assertEquals(2, route.get().getStops().size());
        assertEquals(StopKind.VISIT, route.get().getStops().get(0).getKind());
        assertEquals("VISIT-1", route.get().getStops().get(0).getLinkedUnitId());
        assertEquals("Toko Makmur", route.get().getStops().get(0).getCustomerName());
        assertEquals(StopKind.TRANSFER, route.get().getStops().get(1).getKind());
        assertEquals("STE-0001", route.get().getStops().get(1).getLinkedUnitId());
        assertEquals(8, route.get().getStartTime().getHour());
    }

    @Test
    void testNoRouteToday() {
        server.expect(requestTo(BASE + "frm.api.route.get_todays_route"))
                .andRespond(withSuccess("{\"message\": {\"route\": null, \"message\": \"No route assigned for today\"}}",
                        MediaType.APPLICATION_JSON));

        assertTrue(client.getTodaysRoute("agent-7").isEmpty());
    }

    @Test
    void testArriveAtStopSendsLocation() {
        server.expect(requestTo(BASE + "frm.api.route.update_route_stop_status"))
                .andExpect(jsonPath("$.route_name").value("ROUTE-2024-0001"))
                .andExpect(jsonPath("$.stop_idx").value(2))
                .andExpect(jsonPath("$.status").value("arrived"))
                .andExpect(jsonPath("$.latitude").value(-6.2))
                .andExpect(jsonPath("$.longitude").value(106.8))
                .andRespond(withSuccess("""
                        {"message": {"route": {"name": "ROUTE-2024-0001", "status": "in_progress",
                          "stops": [{"idx": 2, "sequence": 2, "stop_type": "Sales Visit", "status": "arrived"}]}}}
                        """, MediaType.APPLICATION_JSON));

        Route route = client.arriveAtStop("ROUTE-2024-0001", 2, new GeoPoint(-6.2, 106.8));

        server.verify();
        assertEquals(StopStatus.ARRIVED, route.findStop(2).orElseThrow().getStatus());
    }

    @Test
    void testSkipStopSendsReason() {
        server.expect(requestTo(BASE + "frm.api.route.update_route_stop_status"))
                .andExpect(jsonPath("$.status").value("skipped"))
                .andExpect(jsonPath("$.skip_reason").value("Shop closed"))
                .andRespond(withSuccess("""
                        {"message": {"name": "ROUTE-2024-0001", "status": "in_progress",
                          "stops": [{"idx": 1, "sequence": 1, "stop_type": "Sales Visit", "status": "skipped"}]}}
                        """, MediaType.APPLICATION_JSON));

        Route route = client.skipStop("ROUTE-2024-0001", 1, "Shop closed");

        server.verify();
        assertEquals(StopStatus.SKIPPED, route.findStop(1).orElseThrow().getStatus());
    }

    @Test
    void testGetVisit() {
        server.expect(requestTo(BASE + "frm.api.visit.get_visit_details"))
                .andExpect(jsonPath("$.sales_visit").value("VISIT-1"))
                .andRespond(withSuccess("""
                        {"message": {"name": "VISIT-1", "status": "in_progress", "customer": "CUST-1",
                          "check_in_time": "2024-05-01 09:15:00",
                          "activities": [
                            {"key": "photos", "activity_type": "Photo", "activity_name": "Take Photo",
                             "sequence": 1, "mandatory": true, "status": "completed"},
                            {"activity_type": "Stock Check", "activity_name": "Stock Opname", "sequence": 2,
                             "mandatory": true, "status": "pending"}
                          ]}}
                        """, MediaType.APPLICATION_JSON));

        Visit visit = client.getVisit("VISIT-1");

        assertEquals("VISIT-1", visit.getId());
        assertEquals(VisitStatus.IN_PROGRESS, visit.getStatus());
        assertEquals(2, visit.getActivities().size());
        assertEquals(ActivityType.PHOTO, visit.getActivities().get(0).getType());
        assertEquals(ActivityStatus.COMPLETED, visit.getActivities().get(0).getStatus());
        assertEquals(ActivityType.STOCK_CHECK, visit.getActivities().get(1).getType());
        assertEquals("Stock Opname", visit.getActivities().get(1).getName());
    }

    @Test
    void testMarkActivitySendsResultAsJsonString() throws Exception {
        server.expect(requestTo(BASE + "frm.api.visit.mark_activity_completed"))
                .andExpect(jsonPath("$.sales_visit").value("VISIT-1"))
                .andExpect(jsonPath("$.activity_type").value("Custom"))
                .andExpect(jsonPath("$.activity_name").value("Sales Order"))
                .andExpect(jsonPath("$.status").doesNotExist())
                .andExpect(jsonPath("$.result_data").isString())
                .andRespond(withSuccess("{\"message\": {\"success\": true}}", MediaType.APPLICATION_JSON));

        client.markActivityCompleted("VISIT-1", "Custom", "Sales Order", null, new OrderResult("SO-0042"));

        server.verify();
    }

    @Test
    void testVisitMediaAcceptsUrlsAndObjects() {
        server.expect(requestTo(BASE + "frm.api.photo.get_visit_photos"))
                .andRespond(withSuccess("""
                        {"message": ["/files/a.jpg", {"name": "FILE-2", "file_url": "/files/b.jpg", "file_name": "b.jpg"}]}
                        """, MediaType.APPLICATION_JSON));

        List<MediaRef> media = client.getVisitMedia("VISIT-1");

        assertEquals(2, media.size());
        assertEquals("/files/a.jpg", media.get(0).getId());
        assertEquals("/files/b.jpg", media.get(1).getUrl());
        assertEquals("b.jpg", media.get(1).getFileName());
    }

    @Test
    void testFinalizeReturnsSyncWarnings() {
        server.expect(requestTo(BASE + "frm.api.visit.complete"))
                .andRespond(withSuccess("""
                        {"message": {"visit_id": "VISIT-1", "status": "In Progress", "compliance_score": 80.0,
                          "sync_warnings": ["Sales order could not be submitted"]}}
                        """, MediaType.APPLICATION_JSON));

        FinalizeResponse response = client.finalizeVisit("VISIT-1");

        assertTrue(response.hasWarnings());
        assertEquals(List.of("Sales order could not be submitted"), response.getSyncWarnings());
        assertEquals(80.0, response.getComplianceScore());
    }

    @Test
    void testTransferItemsFlattenedFromDeliveryGroups() {
        server.expect(requestTo(BASE + "frm.api.stock_transfer.get_transfer_detail"))
                .andExpect(jsonPath("$.transfer_id").value("STE-0001"))
                .andRespond(withSuccess("""
                        {"message": {
                          "transfer": {"name": "STE-0001", "status": "loading", "type": "wh_to_dc",
                                       "source_warehouse": "WH-Central", "dest_warehouse": "DC-North"},
                          "items_by_delivery": [
                            {"delivery_order": "DO-1", "items": [
                              {"product_code": "SKU-1", "expected_qty": 10, "check_status": "verified", "verified_qty": 10}]},
                            {"delivery_order": "DO-2", "items": [
                              {"product_code": "SKU-2", "expected_qty": 4, "check_status": "pending"}]}
                          ],
                          "linked_deliveries": [{"name": "DO-1"}, "DO-2"]}}
                        """, MediaType.APPLICATION_JSON));

        Transfer transfer = client.getTransferDetail("STE-0001");

        assertEquals(TransferStatus.LOADING, transfer.getStatus());
        assertEquals("DC-North", transfer.getDestWarehouse());
        assertEquals(2, transfer.getItems().size());
        assertEquals("DO-2", transfer.getItems().get(1).getDeliveryOrder());
        assertEquals(ItemCheckStatus.VERIFIED, transfer.getItems().get(0).getCheckStatus());
        assertEquals(List.of("DO-1", "DO-2"), transfer.getLinkedDeliveries());
        assertEquals(1, transfer.getUnaccountedItems().size());
    }

    @Test
    void testArriveWithoutFixOmitsLocation() {
        server.expect(requestTo(BASE + "frm.api.stock_transfer.arrive_at_dc"))
                .andExpect(jsonPath("$.transfer_id").value("STE-0001"))
                .andExpect(jsonPath("$.latitude").doesNotExist())
                .andRespond(withSuccess());

        client.arriveAtDestination("STE-0001", GeoPoint.unknown());

        server.verify();
    }

    @Test
    void testUploadReturnsFileUrl() {
        server.expect(requestTo("http://backend.test/api/method/upload_file"))
                .andExpect(jsonPath("$.docname").value("STE-0001"))
                .andExpect(jsonPath("$.filedata").value("aGFuZG9mZg=="))
                .andRespond(withSuccess("{\"message\": {\"file_url\": \"/files/handoff.jpg\"}}",
                        MediaType.APPLICATION_JSON));

        assertEquals("/files/handoff.jpg", client.uploadTransferPhoto("STE-0001", "handoff.jpg", "aGFuZG9mZg=="));
    }

    @Test
    void testGatewayErrorIsTransient() {
        server.expect(requestTo(BASE + "frm.api.visit.complete"))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        BackendUnavailableException e = assertThrows(BackendUnavailableException.class,
                () -> client.finalizeVisit("VISIT-1"));
        assertEquals("frm.api.visit.complete", e.getMethod());
    }

    @Test
    void testIoErrorIsTransient() {
        server.expect(requestTo(BASE + "frm.api.visit.complete"))
                .andRespond(withException(new SocketTimeoutException("Read timed out")));

        assertThrows(BackendUnavailableException.class, () -> client.finalizeVisit("VISIT-1"));
    }

    @Test
    void testInternalErrorIsNotTransient() {
        server.expect(requestTo(BASE + "frm.api.visit.complete"))
                .andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));

        FieldBackendException e = assertThrows(FieldBackendException.class, () -> client.finalizeVisit("VISIT-1"));
        assertFalse(e instanceof BackendUnavailableException);
    }

    @Test
    void testRejectionCarriesServerMessage() throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        String serverMessages = mapper.writeValueAsString(List.of("{\"message\": \"Stop 3 is locked\"}"));
        String body = mapper.writeValueAsString(Map.of("exc_type", "ValidationError", "_server_messages", serverMessages));
        server.expect(requestTo(BASE + "frm.api.route.update_route_stop_status"))
                .andRespond(withStatus(HttpStatus.EXPECTATION_FAILED).body(body).contentType(MediaType.APPLICATION_JSON));

        BackendRejectedException e = assertThrows(BackendRejectedException.class,
                () -> client.completeStop("ROUTE-2024-0001", 3));
        assertEquals(417, e.getStatus());
        assertEquals("Stop 3 is locked", e.getMessage());
    }
}
