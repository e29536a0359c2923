package com.poststudio.infrastructure.typehandler;

import com.poststudio.types.enums.DraftStatusEnum;
import org.apache.ibatis.type.MappedTypes;

@MappedTypes(DraftStatusEnum.class)
public class DraftStatusEnumTypeHandler extends AbstractCodeEnumTypeHandler<DraftStatusEnum> {

    @Override
    protected String toCode(DraftStatusEnum value) {
        return value.getCode();
    }

    @Override
    protected DraftStatusEnum fromCode(String code) {
        return DraftStatusEnum.fromCode(code);
    }
}
