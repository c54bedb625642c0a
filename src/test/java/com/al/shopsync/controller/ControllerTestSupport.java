package com.al.shopsync.controller;

import com.al.shopsync.config.WebConfig;
import com.al.shopsync.exception.GlobalExceptionHandler;
import org.springframework.format.support.DefaultFormattingConversionService;
import org.springframework.format.support.FormattingConversionService;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

final class ControllerTestSupport {

    private ControllerTestSupport() {
    }

    static MockMvc mockMvc(Object controller) {
        FormattingConversionService conversionService = new DefaultFormattingConversionService();
        conversionService.addConverter(new WebConfig.StringToEntityTypeConverter());
        conversionService.addConverter(new WebConfig.StringToSyncModeConverter());
        return MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .setConversionService(conversionService)
                .build();
    }
}
