package com.pipedesk.drive.service.db;

import com.pipedesk.drive.enums.EntityTypeEnum;
import com.pipedesk.drive.exception.MappingConflictException;
import com.pipedesk.drive.exception.ValidationException;
import com.pipedesk.drive.model.entity.FolderMappingEntity;
import com.pipedesk.drive.service.db.impl.FolderMappingService;
import com.pipedesk.drive.support.DriveTestBase;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FolderMappingServiceTest extends DriveTestBase {

    @Autowired
    private FolderMappingService folderMappingService;

    @Test
    void ShouldThrowConflictWhenLiveMappingExists() {
        this.folderMappingService.insertMapping(EntityTypeEnum.DEAL, "D1", "folder-1", null);

        MappingConflictException e = assertThrows(MappingConflictException.class,
                () -> this.folderMappingService.insertMapping(EntityTypeEnum.DEAL, "D1", "folder-2", null));
        assertEquals(409, e.getStatus().value());
        assertEquals("folder-1", this.folderMappingService.findByEntity(EntityTypeEnum.DEAL, "D1").getExternalFolderId());
    }

    @Test
    void ShouldAllowManyRetiredRowsPerEntity() {
        for (int i = 0; i < 3; i++) {
            this.folderMappingService.insertMapping(EntityTypeEnum.LEAD, "L1", "folder-" + i, "https://x/" + i);
            FolderMappingEntity retired =
                    this.folderMappingService.retireMapping(EntityTypeEnum.LEAD, "L1", "tester", "round " + i);
            assertEquals(retired.getFolderMappingId(), retired.getDeleteMarker());
        }
        this.folderMappingService.insertMapping(EntityTypeEnum.LEAD, "L1", "folder-live", null);

        List<FolderMappingEntity> history =
                this.folderMappingService.findByEntityIncludingDeleted(EntityTypeEnum.LEAD, "L1");
        assertEquals(4, history.size());
        assertEquals("folder-live", history.get(0).getExternalFolderId());
        assertEquals("folder-2", history.get(1).getExternalFolderId());
        assertEquals(1L, this.folderMappingService.countLiveByEntity(EntityTypeEnum.LEAD, "L1"));
        assertEquals("round 0", this.folderMappingService.findByExternalFolderId("folder-0").getDeleteReason());
    }

    @Test
    void ShouldValidateArguments() {
        assertThrows(ValidationException.class,
                () -> this.folderMappingService.findByEntity(null, "x"));
        assertThrows(ValidationException.class,
                () -> this.folderMappingService.insertMapping(EntityTypeEnum.DEAL, "D1", " ", null));
        assertThrows(ValidationException.class,
                () -> this.folderMappingService.retireMapping(EntityTypeEnum.DEAL, "D1", "", "reason"));
    }
}
