package com.pipedesk.drive.service.hierarchy;

import com.pipedesk.drive.enums.EntityTypeEnum;
import com.pipedesk.drive.model.entity.FolderMappingEntity;
import com.pipedesk.drive.model.store.StoreItem;
import com.pipedesk.drive.service.db.impl.FolderMappingService;
import com.pipedesk.drive.support.DriveTestBase;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
class HierarchyRaceTest extends DriveTestBase {

    @Autowired
    private HierarchyService hierarchyService;

    @Autowired
    private FolderMappingService folderMappingService;

    @Test
    void ShouldKeepOneMappingWhenTwoCallersRace() throws Exception {
        givenCompany("C1", "Corrida");
        givenLead("L1", "Corrida Lead", "C1");
        FolderMappingEntity company = this.hierarchyService.ensureStructure(EntityTypeEnum.COMPANY, "C1");
        // both callers get past the mapping lookup before either creates its folder
        this.flakyFolderStoreClient.holdCreationsAtBarrier("Lead - ", 2);

        Callable<FolderMappingEntity> ensureLead =
                () -> this.hierarchyService.ensureStructure(EntityTypeEnum.LEAD, "L1");
        ExecutorService pool = Executors.newFixedThreadPool(2);
        FolderMappingEntity first;
        FolderMappingEntity second;
        try {
            Future<FolderMappingEntity> f1 = pool.submit(ensureLead);
            Future<FolderMappingEntity> f2 = pool.submit(ensureLead);
            first = f1.get(30, TimeUnit.SECONDS);
            second = f2.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertEquals(first.getExternalFolderId(), second.getExternalFolderId());
        assertEquals(1L, this.folderMappingService.countLiveByEntity(EntityTypeEnum.LEAD, "L1"));
        assertEquals(1, this.folderMappingService.findByEntityIncludingDeleted(EntityTypeEnum.LEAD, "L1").size());

        // the loser's folder stays behind, empty
        StoreItem leads = onlyChildNamed(company.getExternalFolderId(), "01. Leads");
        List<StoreItem> leadFolders = childrenOf(leads.getId());
        assertEquals(2, leadFolders.size());
        for (StoreItem leadFolder : leadFolders) {
            int expected = leadFolder.getId().equals(first.getExternalFolderId()) ? 6 : 0;
            assertEquals(expected, childrenOf(leadFolder.getId()).size());
        }
    }

    @Test
    void ShouldKeepOneMappingPerEntityWhenManyCallersRace() throws Exception {
        givenCompany("C2", "Muitos");
        int callers = 6;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        try {
            List<Callable<FolderMappingEntity>> tasks = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                tasks.add(() -> this.hierarchyService.ensureStructure(EntityTypeEnum.COMPANY, "C2"));
            }
            List<Future<FolderMappingEntity>> results = pool.invokeAll(tasks, 60, TimeUnit.SECONDS);
            String folderId = results.get(0).get().getExternalFolderId();
            for (Future<FolderMappingEntity> result : results) {
                assertEquals(folderId, result.get().getExternalFolderId());
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1L, this.folderMappingService.countLiveByEntity(EntityTypeEnum.COMPANY, "C2"));
        assertEquals(1L, this.folderMappingService.countLiveByEntity(
                EntityTypeEnum.SYSTEM_ROOT, HierarchyService.SYSTEM_ROOT_ENTITY_ID));
    }
}
