package com.sailfish.taskproc.model;

import jakarta.persistence.*;
import java.io.Serializable;
import java.time.Instant;

/**
 * Control command published on the broker. A null destination addresses every consumer.
 */
@Entity
@Table(name = "task_control_messages")
public class ControlMessage implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String SHUTDOWN = "shutdown";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 50)
    private String command;

    @Column(length = 200)
    private String destination;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    protected ControlMessage() {
        // for JPA
    }

    public ControlMessage(String command, String destination) {
        this.command = command;
        this.destination = destination;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }

    public Long getId() {
        return id;
    }

    public String getCommand() {
        return command;
    }

    public String getDestination() {
        return destination;
    }

    public boolean isBroadcast() {
        return destination == null;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "ControlMessage{id=" + id + ", command='" + command + "', destination='" + destination + "'}";
    }
}
