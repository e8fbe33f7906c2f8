package ru.javaboys.huntymatch.triage;

import org.springframework.stereotype.Component;
import ru.javaboys.huntymatch.model.JobRecord;
import ru.javaboys.huntymatch.model.JobSearchCriteria;
import ru.javaboys.huntymatch.util.TextUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Hard filters of the offer search: industry, minimum salary, location.
 * Keeps catalogue order.
 */
@Component
public class JobCriteriaFilter {

    public List<JobRecord> filter(List<JobRecord> catalogue, JobSearchCriteria criteria) {
        List<JobRecord> result = new ArrayList<>();
        if (catalogue == null) {
            return result;
        }
        JobSearchCriteria c = criteria == null ? JobSearchCriteria.NONE : criteria;
        for (JobRecord job : catalogue) {
            if (job != null && accepts(job, c)) {
                result.add(job);
            }
        }
        return result;
    }

    boolean accepts(JobRecord job, JobSearchCriteria c) {
        if (TextUtils.notBlank(c.getIndustry()) && !c.getIndustry().trim().equalsIgnoreCase(TextUtils.safe(job.getIndustry()).trim())) {
            return false;
        }
        // без зарплаты под минимум не проходит
        if (c.getMinSalary() != null && c.getMinSalary() > 0
                && (job.getSalary() == null || job.getSalary() < c.getMinSalary())) {
            return false;
        }
        if (TextUtils.notBlank(c.getLocation())) {
            String wanted = TextUtils.lower(c.getLocation()).trim();
            String offered = TextUtils.lower(job.getLocation());
            if (!wanted.contains("remote") && !offered.contains("remote") && !offered.contains(wanted)) {
                return false;
            }
        }
        return true;
    }
}
