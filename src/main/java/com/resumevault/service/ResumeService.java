package com.resumevault.service;

import com.resumevault.controller.ResumeDetail;
import com.resumevault.controller.ResumeSummary;
import com.resumevault.controller.ResumeUpdateRequest;
import com.resumevault.model.ResumeFilters;
import com.resumevault.security.ResumePrincipal;

public interface ResumeService {
    ResumeDetail getById(String id);
    ResumeSummary update(String id, ResumeUpdateRequest request, ResumePrincipal principal);
    void delete(String id, ResumePrincipal principal);
    int deleteAll(ResumePrincipal principal);
    ResumeFilters filters();
}
