package com.fieldforce.fieldexecutionbackend.service;

import com.fieldforce.fieldexecutionbackend.dto.TransferBoard;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

@Service
public class TransferUpdatePublisher {

    private final SimpMessagingTemplate messagingTemplate;

    @Autowired
    public TransferUpdatePublisher(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }

    public void publishTransferBoard(TransferBoard board) {
        messagingTemplate.convertAndSend("/topic/transfers/" + board.getTransfer().getId(), board);
    }
}
