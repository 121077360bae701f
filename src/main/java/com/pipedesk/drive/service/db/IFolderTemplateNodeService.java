package com.pipedesk.drive.service.db;

import com.baomidou.mybatisplus.extension.service.IService;
import com.pipedesk.drive.model.entity.FolderTemplateNodeEntity;

public interface IFolderTemplateNodeService extends IService<FolderTemplateNodeEntity> {
}
