package org.example.annotations.controller;

import org.example.annotations.config.ClockConfig;
import org.example.annotations.exception.ExportOptionsException;
import org.example.annotations.service.AnnotationService;
import org.example.annotations.service.export.AnnotationExportService;
import org.example.annotations.service.export.ExportFormat;
import org.example.annotations.service.export.ExportOptions;
import org.example.annotations.service.export.ExportResult;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AnnotationExportController.class)
@Import(ClockConfig.class)
class AnnotationExportControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AnnotationService annotationService;

    @MockitoBean
    private AnnotationExportService exportService;

    @Test
    void exportAnnotations_markdown_returnsAttachment() throws Exception {
        when(annotationService.list("book-1")).thenReturn(List.of());
        when(exportService.export(anyList(), any(ExportOptions.class)))
                .thenReturn(ExportResult.markdown("# Emma\n", "emma-annotations-2024-03-15.md"));

        mockMvc.perform(post("/api/books/book-1/annotations/export")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"format":"markdown","bookTitle":"Emma","includeToc":false,
                                 "filters":{"types":["HIGHLIGHT"],"colors":["blue"]},"dateFormat":"iso"}
                                """))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION,
                        containsString("attachment; filename=\"emma-annotations-2024-03-15.md\"")))
                .andExpect(header().string(HttpHeaders.CONTENT_TYPE, containsString("text/markdown")))
                .andExpect(content().string("# Emma\n"));

        ArgumentCaptor<ExportOptions> options = ArgumentCaptor.forClass(ExportOptions.class);
        verify(exportService).export(anyList(), options.capture());
        assertEquals(ExportFormat.MARKDOWN, options.getValue().format());
        assertEquals(Boolean.FALSE, options.getValue().includeToc());
        assertNull(options.getValue().includeStats());
        assertEquals(1, options.getValue().filters().colors().size());
    }

    @Test
    void exportAnnotations_pdf_returnsBytes() throws Exception {
        byte[] pdf = {'%', 'P', 'D', 'F'};
        when(annotationService.list("book-1")).thenReturn(List.of());
        when(exportService.export(anyList(), any(ExportOptions.class)))
                .thenReturn(ExportResult.pdf(pdf, "emma-annotations-2024-03-15.pdf"));

        mockMvc.perform(post("/api/books/book-1/annotations/export")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"format\":\"pdf\",\"bookTitle\":\"Emma\"}"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CONTENT_TYPE, "application/pdf"))
                .andExpect(content().bytes(pdf));
    }

    @Test
    void exportAnnotations_invalidOptions_returns400WithCode() throws Exception {
        when(annotationService.list("book-1")).thenReturn(List.of());
        when(exportService.export(anyList(), any(ExportOptions.class)))
                .thenReturn(ExportResult.failure(ExportOptionsException.INVALID_FORMAT, "Invalid export format",
                        "emma-annotations-2024-03-15.md"));

        mockMvc.perform(post("/api/books/book-1/annotations/export")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"format\":\"docx\",\"bookTitle\":\"Emma\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code", is("invalid_format")))
                .andExpect(jsonPath("$.path", is("/api/books/book-1/annotations/export")));
    }
}
