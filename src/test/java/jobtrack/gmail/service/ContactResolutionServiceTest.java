package jobtrack.gmail.service;

import jobtrack.gmail.dto.MailMessage;
import jobtrack.gmail.dto.ResolutionOutcome;
import jobtrack.gmail.entity.Company;
import jobtrack.gmail.entity.Contact;
import jobtrack.gmail.entity.ContactStatus;
import jobtrack.gmail.entity.EmailDirection;
import jobtrack.gmail.entity.Interaction;
import jobtrack.gmail.entity.InteractionType;
import jobtrack.gmail.exception.SkippedNoContactException;
import jobtrack.gmail.exception.UnparseableSenderException;
import jobtrack.gmail.repository.CompanyRepository;
import jobtrack.gmail.repository.ContactRepository;
import jobtrack.gmail.repository.InteractionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ContactResolutionServiceTest {
    private static final String USER_ID = "user123";
    private static final String MAILBOX = "jane@example.com";
    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Mock
    private CompanyRepository companyRepository;

    @Mock
    private ContactRepository contactRepository;

    @Mock
    private InteractionRepository interactionRepository;

    private ContactResolutionService resolver;

    @BeforeEach
    void setUp() {
        resolver = new ContactResolutionService(companyRepository, contactRepository, interactionRepository,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void resolve_WithNewSender_ShouldCreateCompanyContactAndInteraction() {
        // Given
        when(companyRepository.findByUserIdAndDedupKey(USER_ID, "acme.io")).thenReturn(Optional.empty());
        when(companyRepository.save(any(Company.class))).thenAnswer(invocation -> companyWithId(invocation.getArgument(0), "company-1"));
        when(contactRepository.findByUserIdAndEmail(USER_ID, "bob@acme.io")).thenReturn(Optional.empty());
        when(contactRepository.save(any(Contact.class))).thenAnswer(invocation -> contactWithId(invocation.getArgument(0), "contact-1"));
        when(interactionRepository.existsByContactIdAndGmailMessageId("contact-1", "m1")).thenReturn(false);

        // When
        ResolutionOutcome outcome = resolver.resolve(USER_ID, MAILBOX,
                message("m1", "Bob Smith <bob@acme.io>", MAILBOX, "Quick question", "Hi Jane"));

        // Then
        assertTrue(outcome.isCompanyCreated());
        assertTrue(outcome.isContactCreated());
        assertTrue(outcome.isInteractionCreated());

        ArgumentCaptor<Company> company = ArgumentCaptor.forClass(Company.class);
        verify(companyRepository).save(company.capture());
        assertEquals("Acme", company.getValue().getName());
        assertEquals("acme.io", company.getValue().getDomain());
        assertEquals("https://acme.io", company.getValue().getWebsite());
        assertEquals(USER_ID, company.getValue().getUserId());

        ArgumentCaptor<Contact> contact = ArgumentCaptor.forClass(Contact.class);
        verify(contactRepository).save(contact.capture());
        assertEquals("Bob Smith", contact.getValue().getName());
        assertEquals("company-1", contact.getValue().getCompanyId());
        assertEquals(ContactStatus.CONNECTED, contact.getValue().getStatus());

        ArgumentCaptor<Interaction> interaction = ArgumentCaptor.forClass(Interaction.class);
        verify(interactionRepository).save(interaction.capture());
        assertEquals("contact-1", interaction.getValue().getContactId());
        assertEquals("m1", interaction.getValue().getGmailMessageId());
        assertEquals(EmailDirection.RECEIVED, interaction.getValue().getDirection());
        assertEquals(InteractionType.EMAIL, interaction.getValue().getType());
        assertEquals("Subject: Quick question\n\nHi Jane", interaction.getValue().getNotes());
        assertTrue(interaction.getValue().isGmailSynced());
    }

    @Test
    void resolve_WithKnownSender_ShouldOnlyCreateInteraction() {
        // Given
        Company company = companyWithId(new Company(), "company-1");
        Contact contact = contact("contact-1", "company-1", ContactStatus.CONNECTED);
        when(companyRepository.findByUserIdAndDedupKey(USER_ID, "acme.io")).thenReturn(Optional.of(company));
        when(contactRepository.findByUserIdAndEmail(USER_ID, "bob@acme.io")).thenReturn(Optional.of(contact));
        when(interactionRepository.existsByContactIdAndGmailMessageId("contact-1", "m2")).thenReturn(false);

        // When
        ResolutionOutcome outcome = resolver.resolve(USER_ID, MAILBOX,
                message("m2", "bob@acme.io", MAILBOX, "Follow up", "..."));

        // Then
        assertFalse(outcome.isCompanyCreated());
        assertFalse(outcome.isContactCreated());
        assertTrue(outcome.isInteractionCreated());
        verify(companyRepository, never()).save(any());
        verify(contactRepository, never()).save(any());
    }

    @Test
    void resolve_WithAlreadyIngestedMessage_ShouldCreateNothing() {
        // Given
        Contact contact = contact("contact-1", "company-1", ContactStatus.CONNECTED);
        when(companyRepository.findByUserIdAndDedupKey(USER_ID, "acme.io")).thenReturn(Optional.of(companyWithId(new Company(), "company-1")));
        when(contactRepository.findByUserIdAndEmail(USER_ID, "bob@acme.io")).thenReturn(Optional.of(contact));
        when(interactionRepository.existsByContactIdAndGmailMessageId("contact-1", "m1")).thenReturn(true);

        // When
        ResolutionOutcome outcome = resolver.resolve(USER_ID, MAILBOX,
                message("m1", "bob@acme.io", MAILBOX, "Quick question", "Hi"));

        // Then
        assertFalse(outcome.isInteractionCreated());
        verify(interactionRepository, never()).save(any());
    }

    @Test
    void resolve_WithWebmailSender_ShouldCreateContactWithoutCompany() {
        // Given
        when(contactRepository.findByUserIdAndEmail(USER_ID, "sam.lee@gmail.com")).thenReturn(Optional.empty());
        when(contactRepository.save(any(Contact.class))).thenAnswer(invocation -> contactWithId(invocation.getArgument(0), "contact-2"));
        when(interactionRepository.existsByContactIdAndGmailMessageId("contact-2", "m3")).thenReturn(false);

        // When
        ResolutionOutcome outcome = resolver.resolve(USER_ID, MAILBOX,
                message("m3", "sam.lee@gmail.com", MAILBOX, "Hello", "Hi"));

        // Then
        assertFalse(outcome.isCompanyCreated());
        assertTrue(outcome.isContactCreated());
        verifyNoInteractions(companyRepository);
        verify(contactRepository).save(argThat(contact ->
                contact.getCompanyId() == null && contact.getName().equals("Sam Lee")));
    }

    @Test
    void resolve_WithAutomatedSender_ShouldSkipWithoutWrites() {
        // When & Then
        assertThrows(SkippedNoContactException.class, () -> resolver.resolve(USER_ID, MAILBOX,
                message("m4", "LinkedIn <no-reply@linkedin.com>", MAILBOX, "New jobs", "...")));

        verifyNoInteractions(companyRepository, contactRepository, interactionRepository);
    }

    @Test
    void resolve_WithUnparseableFrom_ShouldThrow() {
        // When & Then
        assertThrows(UnparseableSenderException.class, () -> resolver.resolve(USER_ID, MAILBOX,
                message("m5", "Mystery Sender", MAILBOX, "?", "?")));

        verifyNoInteractions(companyRepository, contactRepository, interactionRepository);
    }

    @Test
    void resolve_WithSentMessage_ShouldUseFirstOtherRecipientAndSentDirection() {
        // Given
        when(companyRepository.findByUserIdAndDedupKey(USER_ID, "globex.com")).thenReturn(Optional.empty());
        when(companyRepository.save(any(Company.class))).thenAnswer(invocation -> companyWithId(invocation.getArgument(0), "company-3"));
        when(contactRepository.findByUserIdAndEmail(USER_ID, "hank@globex.com")).thenReturn(Optional.empty());
        when(contactRepository.save(any(Contact.class))).thenAnswer(invocation -> contactWithId(invocation.getArgument(0), "contact-3"));
        when(interactionRepository.existsByContactIdAndGmailMessageId("contact-3", "m6")).thenReturn(false);

        // When
        resolver.resolve(USER_ID, MAILBOX,
                message("m6", "Jane <Jane@Example.com>", "jane@example.com, Hank Scorpio <hank@globex.com>", "Thanks", "..."));

        // Then
        verify(interactionRepository).save(argThat(interaction -> interaction.getDirection() == EmailDirection.SENT));
        verify(companyRepository).save(argThat(company -> company.getName().equals("Globex")));
    }

    @Test
    void resolve_WithSentMessageToSelfOnly_ShouldSkip() {
        // When & Then
        assertThrows(SkippedNoContactException.class, () -> resolver.resolve(USER_ID, MAILBOX,
                message("m7", MAILBOX, MAILBOX, "Note to self", "...")));
    }

    @Test
    void resolve_WithContactToReachOut_ShouldMoveToFollowingUp() {
        // Given
        Contact contact = contact("contact-1", "company-1", ContactStatus.TO_REACH_OUT);
        when(companyRepository.findByUserIdAndDedupKey(USER_ID, "acme.io")).thenReturn(Optional.of(companyWithId(new Company(), "company-1")));
        when(contactRepository.findByUserIdAndEmail(USER_ID, "bob@acme.io")).thenReturn(Optional.of(contact));
        when(interactionRepository.existsByContactIdAndGmailMessageId("contact-1", "m8")).thenReturn(false);

        // When
        resolver.resolve(USER_ID, MAILBOX, message("m8", "bob@acme.io", MAILBOX, "Re: intro", "..."));

        // Then
        assertEquals(ContactStatus.FOLLOWING_UP, contact.getStatus());
        verify(contactRepository).save(contact);
    }

    @Test
    void resolve_WithExistingContactWithoutCompany_ShouldLinkCompany() {
        // Given
        Contact contact = contact("contact-1", null, ContactStatus.CONNECTED);
        when(companyRepository.findByUserIdAndDedupKey(USER_ID, "acme.io")).thenReturn(Optional.of(companyWithId(new Company(), "company-1")));
        when(contactRepository.findByUserIdAndEmail(USER_ID, "bob@acme.io")).thenReturn(Optional.of(contact));
        when(contactRepository.save(contact)).thenReturn(contact);
        when(interactionRepository.existsByContactIdAndGmailMessageId("contact-1", "m9")).thenReturn(true);

        // When
        resolver.resolve(USER_ID, MAILBOX, message("m9", "bob@acme.io", MAILBOX, "Hi", "..."));

        // Then
        assertEquals("company-1", contact.getCompanyId());
    }

    @Test
    void resolve_WithoutDate_ShouldUseCurrentTime() {
        // Given
        when(contactRepository.findByUserIdAndEmail(USER_ID, "sam@gmail.com")).thenReturn(Optional.empty());
        when(contactRepository.save(any(Contact.class))).thenAnswer(invocation -> contactWithId(invocation.getArgument(0), "contact-4"));
        MailMessage undated = MailMessage.builder().messageId("m10").from("sam@gmail.com").to(MAILBOX)
                .subject("Hi").snippet("").build();

        // When
        resolver.resolve(USER_ID, MAILBOX, undated);

        // Then
        verify(interactionRepository).save(argThat(interaction -> interaction.getOccurredAt().equals(NOW)));
    }

    @Test
    void helpers_ShouldDeriveNamesAndTypes() {
        assertEquals("Acme Labs", ContactResolutionService.companyNameFromDomain("www.acme-labs.io"));
        assertEquals("Jane Doe", ContactResolutionService.nameFromLocalPart("jane.doe"));
        assertEquals("acme.io", ContactResolutionService.companyDedupKey("WWW.Acme.io ", null));
        assertEquals("acme labs", ContactResolutionService.companyDedupKey(null, "  Acme   Labs "));
        assertTrue(ContactResolutionService.isWebmailDomain("mail.yahoo.com"));
        assertFalse(ContactResolutionService.isWebmailDomain("notgmail.com"));

        assertEquals(InteractionType.VIDEO_MEETING, ContactResolutionService.determineInteractionType(
                message("x", "a@b.io", MAILBOX, "Meeting tomorrow", "Zoom link below")));
        assertEquals(InteractionType.IN_PERSON_MEETING, ContactResolutionService.determineInteractionType(
                message("x", "a@b.io", MAILBOX, "Meeting tomorrow", "At the office")));
        assertEquals(InteractionType.INFORMATIONAL_INTERVIEW, ContactResolutionService.determineInteractionType(
                message("x", "a@b.io", MAILBOX, "Interview availability", "")));
        assertEquals(InteractionType.COFFEE_CHAT, ContactResolutionService.determineInteractionType(
                message("x", "a@b.io", MAILBOX, "Coffee?", "")));
        assertEquals(InteractionType.EVENT_CONFERENCE, ContactResolutionService.determineInteractionType(
                message("x", "a@b.io", MAILBOX, "Conference recap", "")));
    }

    @Test
    void interactionNotes_WithLongBody_ShouldTruncate() {
        String notes = ContactResolutionService.interactionNotes(
                message("x", "a@b.io", MAILBOX, "Long", "a".repeat(700)));

        assertEquals("Subject: Long\n\n" + "a".repeat(500) + "...", notes);
    }

    private MailMessage message(String id, String from, String to, String subject, String body) {
        return MailMessage.builder()
                .messageId(id)
                .threadId("t-" + id)
                .from(from)
                .to(to)
                .subject(subject)
                .date(Instant.parse("2024-05-30T10:00:00Z"))
                .snippet(body)
                .body(body)
                .build();
    }

    private Contact contact(String id, String companyId, ContactStatus status) {
        Contact contact = new Contact();
        contact.setId(id);
        contact.setUserId(USER_ID);
        contact.setEmail("bob@acme.io");
        contact.setName("Bob");
        contact.setCompanyId(companyId);
        contact.setStatus(status);
        return contact;
    }

    private static Company companyWithId(Company company, String id) {
        company.setId(id);
        return company;
    }

    private static Contact contactWithId(Contact contact, String id) {
        contact.setId(id);
        return contact;
    }
}
