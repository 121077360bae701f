package com.pipedesk.drive.service.db;

import com.baomidou.mybatisplus.extension.service.IService;
import com.pipedesk.drive.model.entity.FileMappingEntity;

public interface IFileMappingService extends IService<FileMappingEntity> {
}
