package com.pipedesk.drive.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.pipedesk.drive.model.entity.FolderTemplateEntity;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface FolderTemplateMapper extends BaseMapper<FolderTemplateEntity> {
}
