package dev.univer.reminder.model;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@Table(uniqueConstraints = @UniqueConstraint(columnNames = {"chatId"}))
public class ChatSettings {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private Long chatId;
    private String chatTitle;

    // Timezone used to read "at 9am" in this chat and to list its reminders
    private String zoneId;
}
