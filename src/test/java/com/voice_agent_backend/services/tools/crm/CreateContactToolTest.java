package com.voice_agent_backend.services.tools.crm;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.voice_agent_backend.models.Contact;
import com.voice_agent_backend.repositories.ContactRepository;
import com.voice_agent_backend.services.tools.ToolContext;
import com.voice_agent_backend.support.JsonFrames;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CreateContactToolTest {

    @Mock
    private ContactRepository contactRepository;

    @InjectMocks
    private CreateContactTool tool;

    @Test
    void newCallerIsSavedForTheOwningUser() {
        when(contactRepository.findFirstByUserIdAndPhoneNumber("user-1", "+34600111222")).thenReturn(Optional.empty());
        when(contactRepository.save(any(Contact.class))).thenAnswer(invocation -> {
            Contact contact = invocation.getArgument(0);
            contact.setId(11L);
            return contact;
        });
        ObjectNode arguments = JsonFrames.MAPPER.createObjectNode()
                .put("first_name", " Lucia ")
                .put("phone", "+34 600 111 222")
                .put("email", "lucia@example.com")
                .put("notes", "");

        Map<String, Object> result = tool.execute(arguments, ToolContext.forUser("user-1"));

        assertThat(result).containsEntry("created", true);
        ArgumentCaptor<Contact> saved = ArgumentCaptor.forClass(Contact.class);
        verify(contactRepository).save(saved.capture());
        assertThat(saved.getValue().getUserId()).isEqualTo("user-1");
        assertThat(saved.getValue().getFirstName()).isEqualTo("Lucia");
        assertThat(saved.getValue().getPhoneNumber()).isEqualTo("+34600111222");
        assertThat(saved.getValue().getEmail()).isEqualTo("lucia@example.com");
        assertThat(saved.getValue().getNotes()).isNull();
        assertThat(saved.getValue().getStatus()).isEqualTo("new");
    }

    @Test
    void knownPhoneReturnsExistingContact() {
        Contact existing = new Contact();
        existing.setId(4L);
        existing.setFirstName("Lucia");
        existing.setPhoneNumber("+34600111222");
        when(contactRepository.findFirstByUserIdAndPhoneNumber("user-1", "+34600111222"))
                .thenReturn(Optional.of(existing));
        ObjectNode arguments = JsonFrames.MAPPER.createObjectNode()
                .put("first_name", "Lucy")
                .put("phone", "+34600111222");

        Map<String, Object> result = tool.execute(arguments, ToolContext.forUser("user-1"));

        assertThat(result).containsEntry("created", false);
        verify(contactRepository, never()).save(any());
    }
}
