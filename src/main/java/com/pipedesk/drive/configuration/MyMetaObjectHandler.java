package com.pipedesk.drive.configuration;

import com.baomidou.mybatisplus.core.handlers.MetaObjectHandler;
import com.pipedesk.drive.model.entity.FolderMappingEntity;
import org.apache.ibatis.reflection.MetaObject;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

@Component
public class MyMetaObjectHandler implements MetaObjectHandler {

    private static final String SYSTEM_USER = "System";

    @Override
    public void insertFill(MetaObject metaObject) {
        // base entity autofill
        this.strictInsertFill(metaObject, "createdUser", String.class, SYSTEM_USER);
        this.strictInsertFill(metaObject, "createdTime", LocalDateTime.class, LocalDateTime.now());
        this.strictInsertFill(metaObject, "lastUpdatedUser", String.class, SYSTEM_USER);
        this.strictInsertFill(metaObject, "lastUpdatedTime", LocalDateTime.class, LocalDateTime.now());

        // folder mapping entity autofill
        this.strictInsertFill(metaObject, "deleteMarker", Long.class, FolderMappingEntity.LIVE_MARKER);

        // folder template entity autofill
        this.strictInsertFill(metaObject, "active", Boolean.class, Boolean.TRUE);
        this.strictInsertFill(metaObject, "sortOrder", Integer.class, 0);
    }

    @Override
    public void updateFill(MetaObject metaObject) {
        this.strictUpdateFill(metaObject, "lastUpdatedUser", String.class, SYSTEM_USER);
        this.strictUpdateFill(metaObject, "lastUpdatedTime", LocalDateTime.class, LocalDateTime.now());
    }
}
