package com.tokentracker.backend.modules.auth.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class AccountRoleConverter implements AttributeConverter<AccountRole, String> {

    @Override
    public String convertToDatabaseColumn(AccountRole attribute) {
        return attribute == null ? null : attribute.getLabel();
    }

    @Override
    public AccountRole convertToEntityAttribute(String dbData) {
        if (dbData == null) {
            return null;
        }
        return AccountRole.fromLabel(dbData)
                .orElseThrow(() -> new IllegalStateException("Unknown account role in store: " + dbData));
    }
}
