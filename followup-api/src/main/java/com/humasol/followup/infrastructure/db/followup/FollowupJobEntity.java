package com.humasol.followup.infrastructure.db.followup;

import com.humasol.common.event.FollowupJobType;
import com.humasol.followup.infrastructure.db.person.PersonEntity;
import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "followup_jobs")
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class FollowupJobEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 12)
    private FollowupJobType type;

    @Column(name = "project_id", nullable = false)
    private Long projectId;

    // persons outlive their jobs, so nothing cascades to the subscriber
    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "subscriber_id", nullable = false)
    private PersonEntity subscriber;

    @Builder.Default
    @OneToMany(cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.EAGER)
    @JoinColumn(name = "job_id", nullable = false)
    @OrderColumn(name = "period_order")
    private List<PeriodEntity> periods = new ArrayList<>();

    @Column(name = "last_notification")
    private LocalDate lastNotification;

    @Column(name = "task_name", length = 100)
    private String name;

    @Column(name = "task_function")
    private String function;
}
