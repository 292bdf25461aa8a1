package uk.gegc.docintake.features.document;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.security.test.context.support.WithMockUser;
import uk.gegc.docintake.BaseIntegrationTest;
import uk.gegc.docintake.features.audit.domain.model.AuditEvent;
import uk.gegc.docintake.features.audit.domain.model.AuditEventTypes;
import uk.gegc.docintake.features.audit.domain.repository.AuditEventRepository;
import uk.gegc.docintake.features.document.domain.repository.DocumentRepository;
import uk.gegc.docintake.features.user.domain.model.User;
import uk.gegc.docintake.features.user.domain.model.UserRole;
import uk.gegc.docintake.features.user.domain.repository.UserRepository;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class DocumentIntakeIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private DocumentRepository documentRepository;

    @Autowired
    private AuditEventRepository auditEventRepository;

    @BeforeEach
    void createUsers() {
        userRepository.save(new User("root", "root@docintake.local", "{noop}secret", UserRole.ADMIN));
        userRepository.save(new User("alice", "alice@docintake.local", "{noop}secret", UserRole.USER));
        entityManager.flush();
    }

    @Test
    @DisplayName("admin bulk import creates users, stores the file and audits both steps")
    @WithMockUser(username = "root", roles = "ADMIN")
    void bulkImport_byAdmin() throws Exception {
        MockMultipartFile csv = new MockMultipartFile("file", "users.csv", "text/csv",
                "Username,Email,Password,Role\ncarol,carol@x.com,pw123,User\nbob,bad,,Admin\n"
                        .getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/v1/documents").file(csv).param("process", "BulkImport").with(csrf()))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.document.processed").value(true))
                .andExpect(jsonPath("$.document.analysisResult").value("Processed: 1 success, 1 failed."))
                .andExpect(jsonPath("$.importErrors[0]").value("Line 3: Missing required fields."));

        assertThat(userRepository.findByUsername("carol")).isPresent();
        assertThat(userRepository.existsByUsername("bob")).isFalse();
        assertThat(documentRepository.count()).isEqualTo(1);

        List<AuditEvent> imports = auditEventRepository.findByEventTypeOrderByTimestampAsc(AuditEventTypes.USER_IMPORT);
        List<AuditEvent> uploads = auditEventRepository.findByEventTypeOrderByTimestampAsc(AuditEventTypes.DOCUMENT_UPLOAD);
        assertThat(imports).singleElement()
                .extracting(AuditEvent::getDescription)
                .isEqualTo("Imported users from users.csv: Processed: 1 success, 1 failed.");
        assertThat(uploads).singleElement()
                .extracting(AuditEvent::getDescription)
                .isEqualTo("User uploaded users.csv");
    }

    @Test
    @DisplayName("a regular user cannot bulk import and nothing is stored")
    @WithMockUser(username = "alice")
    void bulkImport_byUser_isForbidden() throws Exception {
        MockMultipartFile csv = new MockMultipartFile("file", "users.csv", "text/csv",
                "Username,Email,Password,Role\ncarol,carol@x.com,pw123,User\n".getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/v1/documents").file(csv).param("process", "BulkImport").with(csrf()))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.detail").value("Only admins can perform bulk user uploads."));

        assertThat(documentRepository.count()).isZero();
        assertThat(userRepository.existsByUsername("carol")).isFalse();
    }

    @Test
    @DisplayName("analysis without an API key yields the mock invoice and is listed for the owner")
    @WithMockUser(username = "alice")
    void analyze_withoutApiKey_usesMock() throws Exception {
        MockMultipartFile pdf = new MockMultipartFile("file", "invoice_2024.pdf", "application/pdf",
                "%PDF-1.4 placeholder".getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/v1/documents").file(pdf).param("process", "Analyze").with(csrf()))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.document.analysisResult.documentType").value("Invoice"))
                .andExpect(jsonPath("$.document.analysisResult.invoiceData.invoiceNumber").value("INV-MOCK-001"));

        mockMvc.perform(get("/api/v1/documents"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content[0].fileName").value("invoice_2024.pdf"));

        assertThat(auditEventRepository.findByEventTypeOrderByTimestampAsc(AuditEventTypes.AI_ANALYSIS_WARNING))
                .hasSize(1);

        mockMvc.perform(get("/api/v1/audit-events"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content.length()").value(2));
    }
}
