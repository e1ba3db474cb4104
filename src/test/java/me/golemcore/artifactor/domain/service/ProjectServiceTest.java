package me.golemcore.artifactor.domain.service;

import me.golemcore.artifactor.adapter.outbound.project.InMemoryProjectAdapter;
import me.golemcore.artifactor.domain.exception.GuardrailViolationException;
import me.golemcore.artifactor.domain.exception.ProjectNotFoundException;
import me.golemcore.artifactor.domain.model.Project;
import me.golemcore.artifactor.domain.model.ProjectStatus;
import me.golemcore.artifactor.infrastructure.config.ArtifactorProperties;
import me.golemcore.artifactor.port.outbound.SourceAccessPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class ProjectServiceTest {

    private ProjectService service;

    @BeforeEach
    void setUp() {
        ArtifactorProperties properties = new ArtifactorProperties();
        service = new ProjectService(new InMemoryProjectAdapter(Clock.systemUTC()),
                new GuardrailEvaluator(mock(SourceAccessPort.class), properties));
    }

    @Test
    void shouldCreatePendingProject() {
        Project project = service.create("  Shop  ", " /srv/shop ");

        assertNotNull(project.getId());
        assertEquals("Shop", project.getName());
        assertEquals("/srv/shop", project.getSourcePath());
        assertEquals(ProjectStatus.PENDING, project.getStatus());
        assertNotNull(project.getCreatedAt());
        assertEquals(project, service.get(project.getId()));
        assertEquals(1, service.list().size());
    }

    @Test
    void shouldRejectBlankNameOrPath() {
        assertThrows(GuardrailViolationException.class, () -> service.create(" ", "/srv"));
        assertThrows(IllegalArgumentException.class, () -> service.create("Shop", ""));
    }

    @Test
    void shouldThrowForUnknownProject() {
        assertThrows(ProjectNotFoundException.class, () -> service.get("nope"));
    }
}
