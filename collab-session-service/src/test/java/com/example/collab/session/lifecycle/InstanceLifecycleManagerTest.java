package com.example.collab.session.lifecycle;

import com.example.collab.session.service.SessionCoordinator;
import com.example.collab.shared.config.AppProperties;
import com.example.collab.shared.service.directory.ConnectionDirectory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Set;

import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InstanceLifecycleManagerTest {

    @Mock
    private ConnectionDirectory connectionDirectory;
    @Mock
    private SessionCoordinator sessionCoordinator;

    private InstanceLifecycleManager manager;

    @BeforeEach
    void setUp() {
        AppProperties properties = new AppProperties();
        properties.setClusterName("test");
        properties.setInstanceId("instance-1");
        manager = new InstanceLifecycleManager(properties, connectionDirectory, sessionCoordinator);
    }

    @Test
    void staleInstancesAreRemovedAndAnnounced() {
        when(connectionDirectory.findStaleInstances(anyLong())).thenReturn(Set.of("instance-1", "instance-9"));
        when(connectionDirectory.removeInstance("instance-9")).thenReturn(Set.of("c1", "c2"));

        manager.reapStaleInstances();

        verify(sessionCoordinator).announceDeparture("instance-9");
        verify(sessionCoordinator).forgetInstance("instance-9");
        verify(connectionDirectory, never()).removeInstance("instance-1");
    }

    @Test
    void heartbeatIsSkippedWhileDraining() {
        when(sessionCoordinator.isDraining()).thenReturn(true);

        manager.updateSelfHeartbeat();
        manager.reapStaleInstances();

        verifyNoInteractions(connectionDirectory);
    }

    @Test
    void heartbeatStampsThisInstance() {
        manager.updateSelfHeartbeat();

        verify(connectionDirectory).recordInstanceHeartbeat("instance-1");
    }

    @Test
    void reapFailureIsContained() {
        when(connectionDirectory.findStaleInstances(anyLong())).thenThrow(new IllegalStateException("store down"));

        manager.reapStaleInstances();

        verify(sessionCoordinator, never()).announceDeparture(anyString());
    }
}
