package com.pipedesk.drive.service.db;

import com.baomidou.mybatisplus.extension.service.IService;
import com.pipedesk.drive.model.entity.FolderTemplateEntity;

public interface IFolderTemplateService extends IService<FolderTemplateEntity> {
}
