package com.flamingo.ai.studymind.api.rest;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.studymind.service.storage.ObjectStorageService;
import java.io.IOException;
import java.io.UncheckedIOException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class FileControllerTest {

  @Mock private ObjectStorageService objectStorageService;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc = MockMvcBuilders.standaloneSetup(new FileController(objectStorageService)).build();
  }

  @Test
  void shouldServeStoredFile_withContentTypeFromExtension() throws Exception {
    // Given
    byte[] pdf = {37, 80, 68, 70};
    when(objectStorageService.download("2026-10-19/genetics_1.pdf")).thenReturn(pdf);

    // When / Then
    mockMvc
        .perform(get("/files/2026-10-19/genetics_1.pdf"))
        .andExpect(status().isOk())
        .andExpect(content().contentType(MediaType.APPLICATION_PDF))
        .andExpect(content().bytes(pdf));
  }

  @Test
  void shouldReturnNotFound_whenFileMissing() throws Exception {
    // Given
    when(objectStorageService.download("2026-10-19/missing.png"))
        .thenThrow(new UncheckedIOException("gone", new IOException("no such file")));

    // When / Then
    mockMvc.perform(get("/files/2026-10-19/missing.png")).andExpect(status().isNotFound());
  }
}
