package com.jquest.api.domain.resource;

import com.jquest.api.core.resource.ModelResource;
import com.jquest.api.domain.model.Language;
import org.springframework.stereotype.Component;

@Component
public class LanguageResource extends ModelResource<Language> {

    public LanguageResource() {
        super("language", Language.class);
        alwaysReturnData();
    }
}
