package com.poststudio.infrastructure.typehandler;

import com.poststudio.types.enums.EditSourceEnum;
import org.apache.ibatis.type.MappedTypes;

@MappedTypes(EditSourceEnum.class)
public class EditSourceEnumTypeHandler extends AbstractCodeEnumTypeHandler<EditSourceEnum> {

    @Override
    protected String toCode(EditSourceEnum value) {
        return value.getCode();
    }

    @Override
    protected EditSourceEnum fromCode(String code) {
        return EditSourceEnum.fromCode(code);
    }
}
