package com.fieldforce.fieldexecutionbackend.service;

import com.fieldforce.fieldexecutionbackend.dto.RouteBoard;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import static org.mockito.Mockito.*;

class RouteUpdatePublisherTest {

    private SimpMessagingTemplate messagingTemplate;
    private RouteUpdatePublisher publisher;

    @BeforeEach
    void setUp() {
        messagingTemplate = mock(SimpMessagingTemplate.class);
        publisher = new RouteUpdatePublisher(messagingTemplate);
    }

    @Test
    void testPublishRouteBoard() {
        RouteBoard board = new RouteBoard();
        board.setRouteId("ROUTE-2024-0001");

        publisher.publishRouteBoard(board);

        verify(messagingTemplate, times(1))
                .convertAndSend("/topic/routes/ROUTE-2024-0001", board);
    }
}
