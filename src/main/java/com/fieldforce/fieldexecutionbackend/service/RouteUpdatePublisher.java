package com.fieldforce.fieldexecutionbackend.service;

import com.fieldforce.fieldexecutionbackend.dto.RouteBoard;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

@Service
public class RouteUpdatePublisher {

    private final SimpMessagingTemplate messagingTemplate;

    @Autowired
    public RouteUpdatePublisher(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }

    public void publishRouteBoard(RouteBoard board) {
        messagingTemplate.convertAndSend("/topic/routes/" + board.getRouteId(), board);
    }
}
