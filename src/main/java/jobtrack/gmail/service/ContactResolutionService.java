package jobtrack.gmail.service;

import jobtrack.gmail.dto.MailMessage;
import jobtrack.gmail.dto.ParsedAddress;
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
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Entity resolver: maps one mail message to Company, Contact and Interaction rows of a user.
 * <p>
 * Lookups run company, then contact, then interaction, each as find-by-dedup-key followed by
 * create-if-absent. Every row read or written is scoped to the given user.
 */
@Slf4j
@Service
public class ContactResolutionService {
    private static final List<String> WEBMAIL_DOMAINS = List.of(
            "gmail.com", "googlemail.com", "yahoo.com", "hotmail.com", "outlook.com", "live.com",
            "icloud.com", "aol.com", "protonmail.com", "mail.com", "zoho.com");

    private static final Pattern AUTOMATED_LOCAL_PART = Pattern.compile(
            "^(no-?reply|do-?not-?reply|mailer-daemon|postmaster|notifications?|bounces?|auto-?confirm)([+._-].*)?$");

    private static final Pattern COMMON_TLD = Pattern.compile("\\.(com|org|net|io|ai|co|edu|gov)$");
    private static final int MAX_NOTES_BODY = 500;

    private final CompanyRepository companyRepository;
    private final ContactRepository contactRepository;
    private final InteractionRepository interactionRepository;
    private final Clock clock;

    public ContactResolutionService(CompanyRepository companyRepository, ContactRepository contactRepository,
                                    InteractionRepository interactionRepository, Clock clock) {
        this.companyRepository = companyRepository;
        this.contactRepository = contactRepository;
        this.interactionRepository = interactionRepository;
        this.clock = clock;
    }

    /**
     * Resolves a message of the mailbox {@code mailboxAddress} into CRM rows owned by {@code userId}.
     *
     * @throws UnparseableSenderException if the From header has no valid address
     * @throws SkippedNoContactException if the counterpart is automated or there is none besides the owner
     */
    @Transactional
    public ResolutionOutcome resolve(String userId, String mailboxAddress, MailMessage message) {
        ParsedAddress sender = EmailAddressParser.parse(message.getFrom())
                .orElseThrow(() -> new UnparseableSenderException(
                        "No valid sender address in From header '" + message.getFrom() + "'"));

        boolean fromOwner = mailboxAddress != null && sender.getEmail().equalsIgnoreCase(mailboxAddress);
        ParsedAddress counterpart = fromOwner ? firstRecipient(message, mailboxAddress) : sender;
        EmailDirection direction = fromOwner ? EmailDirection.SENT : EmailDirection.RECEIVED;

        if (isAutomated(counterpart)) {
            throw new SkippedNoContactException("Automated sender " + counterpart.getEmail());
        }

        // company -> contact -> interaction, so a contact never points at a missing company
        boolean companyCreated = false;
        Company company = null;
        if (!isWebmailDomain(counterpart.getDomain())) {
            String domain = companyDedupKey(counterpart.getDomain(), null);
            Optional<Company> existing = companyRepository.findByUserIdAndDedupKey(userId, domain);
            if (existing.isPresent()) {
                company = existing.get();
            } else {
                company = createCompany(userId, domain);
                companyCreated = true;
            }
        }

        boolean contactCreated = false;
        Contact contact = contactRepository.findByUserIdAndEmail(userId, counterpart.getEmail()).orElse(null);
        if (contact == null) {
            contact = createContact(userId, counterpart, company);
            contactCreated = true;
        } else if (contact.getCompanyId() == null && company != null) {
            contact.setCompanyId(company.getId());
            contact = contactRepository.save(contact);
        }

        boolean interactionCreated = false;
        if (!interactionRepository.existsByContactIdAndGmailMessageId(contact.getId(), message.getMessageId())) {
            createInteraction(userId, contact, message, direction);
            interactionCreated = true;
            if (contact.getStatus() == ContactStatus.TO_REACH_OUT) {
                contact.setStatus(ContactStatus.FOLLOWING_UP);
                contactRepository.save(contact);
            }
        } else {
            log.debug("Message {} already recorded for contact {}", message.getMessageId(), contact.getId());
        }

        return new ResolutionOutcome(companyCreated, contactCreated, interactionCreated);
    }

    private ParsedAddress firstRecipient(MailMessage message, String mailboxAddress) {
        List<ParsedAddress> recipients = EmailAddressParser.parseList(message.getTo());
        recipients.addAll(EmailAddressParser.parseList(message.getCc()));
        return recipients.stream()
                .filter(address -> !address.getEmail().equalsIgnoreCase(mailboxAddress))
                .findFirst()
                .orElseThrow(() -> new SkippedNoContactException(
                        "Sent message " + message.getMessageId() + " has no recipient besides the mailbox owner"));
    }

    private Company createCompany(String userId, String domain) {
        Company company = new Company();
        company.setUserId(userId);
        company.setDomain(domain);
        company.setDedupKey(domain);
        company.setName(companyNameFromDomain(domain));
        company.setWebsite("https://" + domain);
        log.debug("Creating company {} for user {}", domain, userId);
        return companyRepository.save(company);
    }

    private Contact createContact(String userId, ParsedAddress address, Company company) {
        Contact contact = new Contact();
        contact.setUserId(userId);
        contact.setEmail(address.getEmail());
        contact.setName(address.getName().isEmpty() ? nameFromLocalPart(address.getLocalPart()) : address.getName());
        contact.setCompanyId(company != null ? company.getId() : null);
        contact.setStatus(ContactStatus.CONNECTED);
        return contactRepository.save(contact);
    }

    private void createInteraction(String userId, Contact contact, MailMessage message, EmailDirection direction) {
        Interaction interaction = new Interaction();
        interaction.setUserId(userId);
        interaction.setContactId(contact.getId());
        interaction.setType(determineInteractionType(message));
        interaction.setOccurredAt(message.getDate() != null ? message.getDate() : clock.instant());
        interaction.setNotes(interactionNotes(message));
        interaction.setGmailMessageId(message.getMessageId());
        interaction.setGmailThreadId(message.getThreadId());
        interaction.setEmailSubject(truncate(message.getSubject(), 1000));
        interaction.setEmailSnippet(truncate(message.getSnippet(), 1000));
        interaction.setDirection(direction);
        interaction.setGmailSynced(true);
        interactionRepository.save(interaction);
    }

    static boolean isWebmailDomain(String domain) {
        String normalized = domain.toLowerCase(Locale.ROOT);
        return WEBMAIL_DOMAINS.stream()
                .anyMatch(webmail -> normalized.equals(webmail) || normalized.endsWith("." + webmail));
    }

    static boolean isAutomated(ParsedAddress address) {
        String localPart = address.getLocalPart();
        return AUTOMATED_LOCAL_PART.matcher(localPart).matches() || localPart.contains("noreply");
    }

    static String normalizeDomain(String domain) {
        String normalized = domain.trim().toLowerCase(Locale.ROOT);
        return normalized.startsWith("www.") ? normalized.substring(4) : normalized;
    }

    /**
     * Dedup key for a company: its normalized domain, or its trimmed lower-cased name when there is no domain.
     */
    public static String companyDedupKey(String domain, String name) {
        if (domain != null && !domain.isBlank()) {
            return normalizeDomain(domain);
        }
        return name.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    static String companyNameFromDomain(String domain) {
        String base = COMMON_TLD.matcher(normalizeDomain(domain)).replaceFirst("");
        return titleCase(base.split("[.-]"));
    }

    static String nameFromLocalPart(String localPart) {
        return titleCase(localPart.split("[._-]"));
    }

    static InteractionType determineInteractionType(MailMessage message) {
        String subject = lower(message.getSubject());
        String body = lower(message.getBody());

        if (subject.contains("interview") || body.contains("interview")) {
            return InteractionType.INFORMATIONAL_INTERVIEW;
        }
        if (subject.contains("meeting") || body.contains("meeting")) {
            if (body.contains("zoom") || body.contains("teams") || body.contains("google meet")) {
                return InteractionType.VIDEO_MEETING;
            }
            return InteractionType.IN_PERSON_MEETING;
        }
        if (subject.contains("coffee") || body.contains("coffee chat")) {
            return InteractionType.COFFEE_CHAT;
        }
        if (subject.contains("event") || subject.contains("conference")) {
            return InteractionType.EVENT_CONFERENCE;
        }
        return InteractionType.EMAIL;
    }

    static String interactionNotes(MailMessage message) {
        StringBuilder notes = new StringBuilder("Subject: ").append(message.getSubject()).append("\n\n");
        String content = message.getBody() != null && !message.getBody().isEmpty() ? message.getBody() : message.getSnippet();
        if (content != null && !content.isEmpty()) {
            notes.append(content.length() > MAX_NOTES_BODY ? content.substring(0, MAX_NOTES_BODY) + "..." : content);
        }
        return notes.toString();
    }

    private static String titleCase(String[] words) {
        return Arrays.stream(words)
                .filter(word -> !word.isEmpty())
                .map(word -> Character.toUpperCase(word.charAt(0)) + word.substring(1))
                .collect(Collectors.joining(" "));
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
